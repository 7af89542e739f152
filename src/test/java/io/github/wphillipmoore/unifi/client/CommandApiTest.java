package io.github.wphillipmoore.unifi.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.wphillipmoore.unifi.client.command.CommandEnvelope;
import io.github.wphillipmoore.unifi.client.command.GuestAuthorization;
import io.github.wphillipmoore.unifi.client.options.RequestOptions;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CommandApiTest {

  private static final String BASE_URL = "https://controller:8443";
  private static final String STAMGR_URL = BASE_URL + "/api/s/default/cmd/stamgr";

  @Mock private UnifiTransport transport;

  private CommandApi commands;

  @BeforeEach
  void setUp() {
    RequestDispatcher dispatcher =
        new RequestDispatcher(BASE_URL, transport, RequestOptions.defaults());
    commands = new CommandApi(dispatcher);
  }

  private void stubOk() {
    when(transport.send(any())).thenReturn(new TransportResponse(200, "{}", Map.of()));
  }

  private TransportRequest captureRequest() {
    ArgumentCaptor<TransportRequest> captor = ArgumentCaptor.forClass(TransportRequest.class);
    verify(transport).send(captor.capture());
    return captor.getValue();
  }

  @Nested
  class AuthorizeGuest {

    @Test
    void buildsEnvelopeWithExtraFields() {
      stubOk();

      commands.authorizeGuest("default", "AA:BB", 60, Map.of("up", 100));

      TransportRequest request = captureRequest();
      assertThat(request.method()).isEqualTo(HttpMethod.POST);
      assertThat(request.url()).isEqualTo(STAMGR_URL);
      assertThat(request.jsonBody())
          .containsExactly(
              Map.entry("cmd", "authorize-guest"),
              Map.entry("mac", "AA:BB"),
              Map.entry("minutes", 60),
              Map.entry("up", 100));
    }

    @Test
    void extraFieldOverridesMac() {
      stubOk();

      commands.authorizeGuest("default", "AA:BB", 60, Map.of("mac", "other"));

      assertThat(captureRequest().jsonBody())
          .containsEntry("mac", "other")
          .containsEntry("minutes", 60)
          .containsEntry("cmd", "authorize-guest");
    }

    @Test
    void extraFieldCannotReplaceDiscriminator() {
      assertThatThrownBy(
              () -> commands.authorizeGuest("default", "AA:BB", 60, Map.of("cmd", "kick-sta")))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("cmd");
    }

    @Test
    void withoutExtrasSendsFixedFields() {
      stubOk();

      commands.authorizeGuest("default", "AA:BB", 30);

      assertThat(captureRequest().jsonBody())
          .containsExactly(
              Map.entry("cmd", "authorize-guest"),
              Map.entry("mac", "AA:BB"),
              Map.entry("minutes", 30));
    }

    @Test
    void typedLimitsAreSent() {
      stubOk();
      GuestAuthorization limits =
          GuestAuthorization.builder().up(512).down(2048).bytes(100).apMac("11:22").build();

      commands.authorizeGuest("default", "AA:BB", 60, limits);

      assertThat(captureRequest().jsonBody())
          .containsExactly(
              Map.entry("cmd", "authorize-guest"),
              Map.entry("mac", "AA:BB"),
              Map.entry("minutes", 60),
              Map.entry("up", 512),
              Map.entry("down", 2048),
              Map.entry("bytes", 100),
              Map.entry("ap_mac", "11:22"));
    }

    @Test
    void siteIsInterpolatedUnchanged() {
      stubOk();

      commands.authorizeGuest("x7k2 q", "AA:BB", 60);

      assertThat(captureRequest().url()).isEqualTo(BASE_URL + "/api/s/x7k2 q/cmd/stamgr");
    }
  }

  @Test
  void unauthorizeGuestSendsMac() {
    stubOk();

    commands.unauthorizeGuest("default", "AA:BB");

    TransportRequest request = captureRequest();
    assertThat(request.url()).isEqualTo(STAMGR_URL);
    assertThat(request.jsonBody())
        .containsExactly(Map.entry("cmd", "unauthorize-guest"), Map.entry("mac", "AA:BB"));
  }

  @Test
  void reconnectClientSendsKick() {
    stubOk();

    commands.reconnectClient("default", "AA:BB");

    TransportRequest request = captureRequest();
    assertThat(request.url()).isEqualTo(STAMGR_URL);
    assertThat(request.jsonBody())
        .containsExactly(Map.entry("cmd", "kick-sta"), Map.entry("mac", "AA:BB"));
  }

  @Test
  void executeSendsArbitraryEnvelope() {
    stubOk();

    commands.execute("lab", CommandEnvelope.of("block-sta").with("mac", "CC:DD"));

    TransportRequest request = captureRequest();
    assertThat(request.url()).isEqualTo(BASE_URL + "/api/s/lab/cmd/stamgr");
    assertThat(request.jsonBody())
        .containsExactly(Map.entry("cmd", "block-sta"), Map.entry("mac", "CC:DD"));
  }

  @Test
  void macIsNotValidated() {
    stubOk();

    commands.reconnectClient("default", "not-a-mac");

    assertThat(captureRequest().jsonBody()).containsEntry("mac", "not-a-mac");
  }

  @Test
  void nullSiteThrowsNullPointerException() {
    assertThatThrownBy(() -> commands.reconnectClient(null, "AA:BB"))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("site");
  }
}
