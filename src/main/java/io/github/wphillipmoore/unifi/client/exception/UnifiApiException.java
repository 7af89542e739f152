package io.github.wphillipmoore.unifi.client.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when the controller answers with {@code meta.rc} other than {@code "ok"}.
 *
 * <p>The {@code payload} is an unmodifiable copy of the parsed response. The {@code
 * controllerMessage} is the {@code meta.msg} value (e.g. {@code "api.err.LoginRequired"}), or
 * {@code null} if absent.
 */
public final class UnifiApiException extends UnifiException {

  private static final long serialVersionUID = 1L;

  private final Map<String, Object> payload;
  private final @Nullable String controllerMessage;

  /**
   * Creates an API exception.
   *
   * @param message description of the failure
   * @param payload the parsed response payload (defensively copied as unmodifiable)
   * @param controllerMessage the controller's {@code meta.msg}, or {@code null}
   */
  public UnifiApiException(
      String message, Map<String, Object> payload, @Nullable String controllerMessage) {
    super(message);
    this.payload =
        Collections.unmodifiableMap(
            new LinkedHashMap<>(Objects.requireNonNull(payload, "payload")));
    this.controllerMessage = controllerMessage;
  }

  /**
   * Returns the parsed response payload. The returned map is unmodifiable.
   *
   * @return an unmodifiable map of the response
   */
  public Map<String, Object> getPayload() {
    return payload;
  }

  /** Returns the controller's {@code meta.msg}, or {@code null} if the response had none. */
  public @Nullable String getControllerMessage() {
    return controllerMessage;
  }
}
