package io.github.wphillipmoore.unifi.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TransportResponseTest {

  @Test
  void headersAreCopied() {
    Map<String, String> headers = new HashMap<>();
    headers.put("location", "/manage");
    TransportResponse response = new TransportResponse(302, "", headers);
    headers.put("extra", "x");

    assertThat(response.headers()).containsOnlyKeys("location");
  }

  @Test
  void classifiesStatus() {
    assertThat(new TransportResponse(204, "", Map.of()).isSuccessful()).isTrue();
    assertThat(new TransportResponse(302, "", Map.of()).isRedirect()).isTrue();
    assertThat(new TransportResponse(302, "", Map.of()).isSuccessful()).isFalse();
    assertThat(new TransportResponse(401, "", Map.of()).isSuccessful()).isFalse();
    assertThat(new TransportResponse(401, "", Map.of()).isRedirect()).isFalse();
  }

  @Test
  void nullBodyThrowsNullPointerException() {
    assertThatThrownBy(() -> new TransportResponse(200, null, Map.of()))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("body");
  }

  @Test
  void nullHeadersThrowNullPointerException() {
    assertThatThrownBy(() -> new TransportResponse(200, "", null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("headers");
  }
}
