package io.github.wphillipmoore.unifi.client;

import java.util.Map;
import java.util.Objects;

/**
 * Immutable response from a controller transport operation.
 *
 * <p>Headers are defensively copied to guarantee unmodifiability. The client returns this raw
 * response from every operation; interpreting the status and body is up to the caller.
 *
 * @param statusCode the HTTP status code
 * @param body the response body text, never null (empty string if no body)
 * @param headers the response headers, never null, unmodifiable
 */
public record TransportResponse(int statusCode, String body, Map<String, String> headers) {

  /** Validates non-null fields and defensively copies headers. */
  public TransportResponse {
    Objects.requireNonNull(body, "body");
    headers = Map.copyOf(Objects.requireNonNull(headers, "headers"));
  }

  /** Returns whether the status code is in the 2xx range. */
  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 300;
  }

  /** Returns whether the status code is in the 3xx range. */
  public boolean isRedirect() {
    return statusCode >= 300 && statusCode < 400;
  }
}
