package io.github.wphillipmoore.unifi.client.auth;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Username and password used to log in to the controller.
 *
 * <p>Held in memory only, never persisted by the client.
 *
 * @param username the username, never null
 * @param password the password, never null
 */
public record LoginCredentials(String username, String password) {

  /** Validates that username and password are non-null. */
  public LoginCredentials {
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(password, "password");
  }

  /** Returns the login request body {@code {username, password}}. */
  public Map<String, Object> toLoginPayload() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("username", username);
    payload.put("password", password);
    return payload;
  }

  /** Omits the password. */
  @Override
  public String toString() {
    return "LoginCredentials[username=" + username + ", password=****]";
  }
}
