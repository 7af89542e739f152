package io.github.wphillipmoore.unifi.client;

import io.github.wphillipmoore.unifi.client.auth.LoginCredentials;
import io.github.wphillipmoore.unifi.client.exception.UnifiMissingCredentialsException;
import io.github.wphillipmoore.unifi.client.options.RequestOptions;
import java.lang.invoke.MethodHandles;
import java.net.CookieManager;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the login state of one client: the last-used credentials and the cookie jar.
 *
 * <p>A successful {@link #login} stores the session cookie in the jar shared by the dispatcher's
 * options, so every later request carries it. The store never polls the controller: an expired
 * session shows up as a failed call, after which the caller runs {@link #relogin()} and repeats
 * the original operation.
 *
 * <p>Credentials stay in memory for the lifetime of the instance and survive {@link #logout()}.
 * The store performs no locking; concurrent logins on one instance race on the stored credentials.
 */
public final class SessionStore {

  static final String LOGIN_PATH = "/api/login";
  static final String LOGOUT_PATH = "/logout";

  private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

  /** Local view of the session, updated by login and logout calls. */
  public enum State {
    /** No login has completed, or the last operation was a logout. */
    UNAUTHENTICATED,
    /** The last login request completed without a transport error. */
    AUTHENTICATED
  }

  private final RequestDispatcher dispatcher;
  private @Nullable LoginCredentials credentials;
  private State state = State.UNAUTHENTICATED;

  /**
   * Creates a session store issuing its login calls through the given dispatcher.
   *
   * @param dispatcher the dispatcher whose options hold the shared cookie jar
   */
  public SessionStore(RequestDispatcher dispatcher) {
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
  }

  /**
   * Stores the credentials and logs in with {@code POST /api/login}.
   *
   * <p>The response body is not inspected. A rejected login surfaces as a {@link
   * io.github.wphillipmoore.unifi.client.exception.UnifiTransportException} when the transport
   * raises HTTP errors; otherwise the caller checks the returned status. Only a 2xx response marks
   * the session {@link State#AUTHENTICATED}. The credentials are stored before the call, so a later
   * {@link #relogin()} reuses them even if this login failed.
   *
   * @param username the username
   * @param password the password
   * @return the raw login response
   */
  public TransportResponse login(String username, String password) {
    LoginCredentials loginCredentials = new LoginCredentials(username, password);
    this.credentials = loginCredentials;
    LOG.info("Logging in to {} as {}", dispatcher.getBaseUrl(), username);
    TransportResponse response = dispatcher.post(LOGIN_PATH, loginCredentials.toLoginPayload());
    state = response.isSuccessful() ? State.AUTHENTICATED : State.UNAUTHENTICATED;
    return response;
  }

  /**
   * Logs in again with the stored credentials.
   *
   * @return the raw login response
   * @throws UnifiMissingCredentialsException if no credentials have been stored
   */
  public TransportResponse relogin() {
    return relogin(null, null);
  }

  /**
   * Logs in again, filling a {@code null} or empty argument from the stored credentials.
   *
   * @param username the username, or {@code null} to reuse the stored one
   * @param password the password, or {@code null} to reuse the stored one
   * @return the raw login response
   * @throws UnifiMissingCredentialsException if a value is neither supplied nor stored; no request
   *     is sent in that case
   */
  public TransportResponse relogin(@Nullable String username, @Nullable String password) {
    LoginCredentials stored = credentials;
    String resolvedUsername = username;
    if (resolvedUsername == null || resolvedUsername.isEmpty()) {
      LOG.debug("Reusing stored username for relogin");
      resolvedUsername = stored != null ? stored.username() : null;
    }
    String resolvedPassword = password;
    if (resolvedPassword == null || resolvedPassword.isEmpty()) {
      LOG.debug("Reusing stored password for relogin");
      resolvedPassword = stored != null ? stored.password() : null;
    }
    if (resolvedUsername == null) {
      throw new UnifiMissingCredentialsException("username");
    }
    if (resolvedPassword == null) {
      throw new UnifiMissingCredentialsException("password");
    }
    return login(resolvedUsername, resolvedPassword);
  }

  /**
   * Seeds the stored credentials without contacting the controller, so that a later {@link
   * #relogin()} can use them.
   *
   * @param credentials the credentials to store
   */
  public void setLoginData(LoginCredentials credentials) {
    this.credentials = Objects.requireNonNull(credentials, "credentials");
  }

  /**
   * Logs out with {@code GET /logout}, without following redirects.
   *
   * <p>The controller answers a logout with a redirect, which is returned as the response rather
   * than followed. Stored credentials are kept, so {@link #relogin()} still works afterwards.
   *
   * @return the raw logout response, normally a 3xx redirect
   */
  public TransportResponse logout() {
    LOG.info("Logging out of {}", dispatcher.getBaseUrl());
    TransportResponse response =
        dispatcher.get(LOGOUT_PATH, null, Map.of(RequestOptions.ALLOW_REDIRECTS, Boolean.FALSE));
    state = State.UNAUTHENTICATED;
    return response;
  }

  /** Returns the stored credentials, or {@code null} if none have been set. */
  public @Nullable LoginCredentials getLoginData() {
    return credentials;
  }

  /**
   * Returns the local session state. Server-side expiry is not tracked: a session that expired on
   * the controller still reads as {@link State#AUTHENTICATED} until the next login or logout.
   */
  public State getState() {
    return state;
  }

  /** Returns the cookie jar shared with every request of this client. */
  public CookieManager getCookieJar() {
    return dispatcher.getOptions().cookieJar();
  }
}
