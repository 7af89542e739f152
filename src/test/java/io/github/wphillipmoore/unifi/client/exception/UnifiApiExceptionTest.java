package io.github.wphillipmoore.unifi.client.exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class UnifiApiExceptionTest {

  @Test
  void keepsPayloadAndControllerMessage() {
    Map<String, Object> payload = Map.of("meta", Map.of("rc", "error"));
    UnifiApiException ex = new UnifiApiException("fail", payload, "api.err.NoSiteContext");
    assertThat(ex.getPayload()).isEqualTo(payload);
    assertThat(ex.getControllerMessage()).isEqualTo("api.err.NoSiteContext");
  }

  @Test
  void payloadIsCopiedAndUnmodifiable() {
    Map<String, Object> payload = new HashMap<>();
    payload.put("data", null);
    UnifiApiException ex = new UnifiApiException("fail", payload, null);
    payload.put("extra", 1);

    assertThat(ex.getPayload()).containsOnlyKeys("data");
    assertThatThrownBy(() -> ex.getPayload().put("x", 1))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void nullPayloadThrowsNullPointerException() {
    assertThatThrownBy(() -> new UnifiApiException("fail", null, null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("payload");
  }
}
