package io.github.wphillipmoore.unifi.client;

/**
 * Transport interface for controller HTTP communication.
 *
 * <p>Implementations perform the actual HTTP exchange. They must attach and update the cookie jar
 * carried by {@link TransportRequest#options()}, honor its TLS verification, timeout and redirect
 * settings, and throw {@link
 * io.github.wphillipmoore.unifi.client.exception.UnifiTransportException} for network, TLS, or
 * (when {@code http_errors} is enabled) HTTP status failures.
 *
 * <p>If one client is shared across threads, the implementation's cookie handling must be
 * thread-safe; the client itself adds no locking.
 */
@FunctionalInterface
public interface UnifiTransport {

  /**
   * Sends a request to the controller and blocks until a response arrives or the call fails.
   *
   * @param request the request to send
   * @return the transport response
   */
  TransportResponse send(TransportRequest request);
}
