package io.github.wphillipmoore.unifi.client.exception;

/**
 * Base exception for all UniFi controller client errors.
 *
 * <p>This is an unchecked exception hierarchy. Every failure raised by the client extends this
 * sealed class, so callers can catch one type and still switch on the concrete kind.
 */
public sealed class UnifiException extends RuntimeException
    permits UnifiTransportException,
        UnifiMissingCredentialsException,
        UnifiResponseException,
        UnifiApiException {

  private static final long serialVersionUID = 1L;

  /** Creates an exception with the given message. */
  public UnifiException(String message) {
    super(message);
  }

  /** Creates an exception with the given message and cause. */
  public UnifiException(String message, Throwable cause) {
    super(message, cause);
  }
}
