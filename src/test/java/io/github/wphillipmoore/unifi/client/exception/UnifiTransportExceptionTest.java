package io.github.wphillipmoore.unifi.client.exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class UnifiTransportExceptionTest {

  @Test
  void constructWithCause() {
    Throwable cause = new RuntimeException("root");
    UnifiTransportException ex =
        new UnifiTransportException("fail", "https://host/api/login", cause);
    assertThat(ex.getMessage()).isEqualTo("fail");
    assertThat(ex.getUrl()).isEqualTo("https://host/api/login");
    assertThat(ex.getCause()).isSameAs(cause);
    assertThat(ex.getStatusCode()).isNull();
    assertThat(ex.getResponseBody()).isNull();
  }

  @Test
  void constructWithStatus() {
    UnifiTransportException ex =
        new UnifiTransportException("fail", "https://host/api/login", 400, "{\"meta\":{}}");
    assertThat(ex.getStatusCode()).isEqualTo(400);
    assertThat(ex.getResponseBody()).isEqualTo("{\"meta\":{}}");
    assertThat(ex.getCause()).isNull();
  }

  @Test
  void nullUrlThrowsWithCause() {
    Throwable cause = new RuntimeException("root");
    assertThatThrownBy(() -> new UnifiTransportException("fail", null, cause))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("url");
  }

  @Test
  void nullUrlThrowsWithStatus() {
    assertThatThrownBy(() -> new UnifiTransportException("fail", null, 500, null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("url");
  }

  @Test
  void isUnifiException() {
    UnifiTransportException ex = new UnifiTransportException("fail", "https://host", 500, null);
    assertThat(ex).isInstanceOf(UnifiException.class);
    assertThat(ex).isInstanceOf(RuntimeException.class);
  }
}
