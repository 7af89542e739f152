package io.github.wphillipmoore.unifi.client.exception;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when a request to the controller cannot be completed.
 *
 * <p>Covers network and TLS failures as well as HTTP error statuses reported by the transport.
 * The {@code statusCode} and {@code responseBody} are {@code null} when no response was received.
 * Expired sessions and rejected credentials surface here like any other HTTP error.
 */
public final class UnifiTransportException extends UnifiException {

  private static final long serialVersionUID = 1L;

  private final String url;
  private final @Nullable Integer statusCode;
  private final @Nullable String responseBody;

  /**
   * Creates a transport exception for a request that produced no response.
   *
   * @param message description of the failure
   * @param url the URL that was being accessed
   * @param cause the underlying cause
   */
  public UnifiTransportException(String message, String url, Throwable cause) {
    super(message, cause);
    this.url = Objects.requireNonNull(url, "url");
    this.statusCode = null;
    this.responseBody = null;
  }

  /**
   * Creates a transport exception for an HTTP error response.
   *
   * @param message description of the failure
   * @param url the URL that was being accessed
   * @param statusCode the HTTP status code
   * @param responseBody the response body text, or {@code null} if unavailable
   */
  public UnifiTransportException(
      String message, String url, int statusCode, @Nullable String responseBody) {
    super(message);
    this.url = Objects.requireNonNull(url, "url");
    this.statusCode = statusCode;
    this.responseBody = responseBody;
  }

  /** Returns the URL that was being accessed when the failure occurred. */
  public String getUrl() {
    return url;
  }

  /**
   * Returns the HTTP status code, or {@code null} if no response was received.
   *
   * @return the status code, or {@code null}
   */
  public @Nullable Integer getStatusCode() {
    return statusCode;
  }

  /**
   * Returns the response body, or {@code null} if no response was received.
   *
   * @return the response body, or {@code null}
   */
  public @Nullable String getResponseBody() {
    return responseBody;
  }
}
