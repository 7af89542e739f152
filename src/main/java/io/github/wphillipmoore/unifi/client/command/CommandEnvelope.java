package io.github.wphillipmoore.unifi.client.command;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * JSON body sent to a site's generic command endpoint: a {@code cmd} discriminator plus
 * parameters.
 *
 * <p>Envelopes are immutable and built per call. Parameters keep insertion order. Fixed fields are
 * added with {@link #with} and caller extras applied last with {@link #overlay}, so an extra field
 * replaces a fixed field of the same name. The discriminator itself is not a parameter and cannot
 * be replaced by either step.
 *
 * @param cmd the command discriminator, e.g. {@code "kick-sta"}
 * @param parameters the command parameters, never containing {@code "cmd"}
 */
public record CommandEnvelope(String cmd, Map<String, Object> parameters) {

  /** Key of the discriminator in the rendered payload. */
  public static final String CMD_KEY = "cmd";

  /** Validates the discriminator and defensively copies the parameters. */
  public CommandEnvelope {
    Objects.requireNonNull(cmd, "cmd");
    Objects.requireNonNull(parameters, "parameters");
    if (parameters.containsKey(CMD_KEY)) {
      throw new IllegalArgumentException("Command parameters must not contain 'cmd'");
    }
    parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
  }

  /**
   * Creates an envelope with no parameters.
   *
   * @param cmd the command discriminator
   * @return a new envelope
   */
  public static CommandEnvelope of(String cmd) {
    return new CommandEnvelope(cmd, Map.of());
  }

  /**
   * Returns a copy with one parameter set.
   *
   * @param key the parameter name
   * @param value the parameter value
   * @return a new envelope
   */
  public CommandEnvelope with(String key, Object value) {
    Map<String, Object> updated = new LinkedHashMap<>(parameters);
    updated.put(Objects.requireNonNull(key, "key"), value);
    return new CommandEnvelope(cmd, updated);
  }

  /**
   * Returns a copy with the extra fields applied on top of the current parameters. An extra field
   * with the same name as an existing parameter replaces it.
   *
   * @param extra the extra fields
   * @return a new envelope
   * @throws IllegalArgumentException if {@code extra} contains {@code "cmd"}
   */
  public CommandEnvelope overlay(Map<String, ?> extra) {
    Objects.requireNonNull(extra, "extra");
    if (extra.isEmpty()) {
      return this;
    }
    Map<String, Object> updated = new LinkedHashMap<>(parameters);
    updated.putAll(extra);
    return new CommandEnvelope(cmd, updated);
  }

  /** Renders the JSON body {@code {cmd, ...parameters}}. */
  public Map<String, Object> toPayload() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put(CMD_KEY, cmd);
    payload.putAll(parameters);
    return payload;
  }
}
