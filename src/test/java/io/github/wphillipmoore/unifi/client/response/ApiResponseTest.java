package io.github.wphillipmoore.unifi.client.response;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.wphillipmoore.unifi.client.TransportResponse;
import io.github.wphillipmoore.unifi.client.exception.UnifiApiException;
import io.github.wphillipmoore.unifi.client.exception.UnifiResponseException;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ApiResponseTest {

  private static final String SITES =
      "{\"meta\":{\"rc\":\"ok\"},\"data\":["
          + "{\"name\":\"default\",\"desc\":\"Default\"},"
          + "{\"name\":\"x7k2q\",\"desc\":\"Lab\"}]}";

  @Test
  void parsesMetaAndData() {
    ApiResponse response = ApiResponse.parse(new TransportResponse(200, SITES, Map.of()));

    assertThat(response.rc()).isEqualTo("ok");
    assertThat(response.msg()).isNull();
    assertThat(response.isOk()).isTrue();
    assertThat(response.data())
        .extracting(row -> row.get("name"))
        .containsExactly("default", "x7k2q");
  }

  @Test
  void requireOkReturnsSameResponse() {
    ApiResponse response = ApiResponse.parse(SITES);

    assertThat(response.requireOk()).isSameAs(response);
  }

  @Test
  void requireOkThrowsOnControllerError() {
    ApiResponse response =
        ApiResponse.parse(
            "{\"meta\":{\"rc\":\"error\",\"msg\":\"api.err.LoginRequired\"},\"data\":[]}");

    assertThat(response.isOk()).isFalse();
    assertThatThrownBy(response::requireOk)
        .isInstanceOfSatisfying(
            UnifiApiException.class,
            e -> assertThat(e.getControllerMessage()).isEqualTo("api.err.LoginRequired"))
        .hasMessageContaining("rc=error");
  }

  @Test
  void missingMetaAndDataAreTolerated() {
    ApiResponse response = ApiResponse.parse("{}");

    assertThat(response.rc()).isNull();
    assertThat(response.data()).isEmpty();
    assertThat(response.isOk()).isFalse();
  }

  @Test
  void invalidJsonThrowsResponseException() {
    assertThatThrownBy(() -> ApiResponse.parse("{not json"))
        .isInstanceOf(UnifiResponseException.class)
        .hasMessageContaining("Invalid JSON");
  }

  @Test
  void nonObjectThrowsResponseException() {
    assertThatThrownBy(() -> ApiResponse.parse("[1,2]"))
        .isInstanceOf(UnifiResponseException.class)
        .hasMessageContaining("not a JSON object");
  }

  @Test
  void emptyBodyThrowsResponseException() {
    assertThatThrownBy(() -> ApiResponse.parse(""))
        .isInstanceOf(UnifiResponseException.class);
  }

  @Test
  void nonListDataThrowsResponseException() {
    assertThatThrownBy(() -> ApiResponse.parse("{\"data\":{\"a\":1}}"))
        .isInstanceOf(UnifiResponseException.class)
        .hasMessageContaining("not a list");
  }

  @Test
  void nonObjectDataEntryThrowsResponseException() {
    assertThatThrownBy(() -> ApiResponse.parse("{\"data\":[1]}"))
        .isInstanceOf(UnifiResponseException.class)
        .hasMessageContaining("non-object");
  }
}
