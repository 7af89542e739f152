package io.github.wphillipmoore.unifi.client;

import io.github.wphillipmoore.unifi.client.auth.LoginCredentials;
import io.github.wphillipmoore.unifi.client.command.GuestAuthorization;
import io.github.wphillipmoore.unifi.client.options.RequestOptions;
import io.github.wphillipmoore.unifi.client.options.VerifyPolicy;
import java.net.CookieManager;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Client for the UniFi controller management API.
 *
 * <p>One instance holds one session: a cookie jar shared by all its requests, plus the credentials
 * of the last login. Log in before calling any other endpoint. Every operation blocks until the
 * transport answers and returns the raw response; nothing is retried. When a call fails because
 * the session expired, call {@link #relogin()} and repeat it.
 *
 * <p>Instances are created via the {@link Builder}:
 *
 * <pre>{@code
 * UnifiClient client = new UnifiClient.Builder("https://127.0.0.1:8443")
 *     .verify(VerifyPolicy.certificateBundle(Path.of("/etc/unifi/cert.pem")))
 *     .build();
 * client.login("admin", "secret");
 * TransportResponse stations = client.statistics("default");
 * }</pre>
 *
 * <p>Controllers ship with a self-signed certificate, so TLS verification is off unless a policy
 * is configured. Pin the controller by downloading its certificate and passing the file path.
 */
public final class UnifiClient {

  private final RequestDispatcher dispatcher;
  private final SessionStore session;
  private final CommandApi commands;

  private UnifiClient(Builder builder) {
    UnifiTransport transport =
        builder.transport != null ? builder.transport : new HttpClientTransport();
    this.dispatcher =
        new RequestDispatcher(builder.baseUrl, transport, RequestOptions.of(builder.options));
    this.session = new SessionStore(dispatcher);
    this.commands = new CommandApi(dispatcher);
  }

  /** Returns the dispatcher used for raw requests. */
  public RequestDispatcher getDispatcher() {
    return dispatcher;
  }

  /** Returns the session store holding credentials and the cookie jar. */
  public SessionStore getSession() {
    return session;
  }

  /** Returns the station manager command API. */
  public CommandApi getCommands() {
    return commands;
  }

  /** Returns the effective request options. */
  public RequestOptions getRequestOptions() {
    return dispatcher.getOptions();
  }

  // Session

  /**
   * Logs in to the controller. Required before other API requests.
   *
   * @param username the username
   * @param password the password
   * @return the raw login response
   * @see SessionStore#login(String, String)
   */
  public TransportResponse login(String username, String password) {
    return session.login(username, password);
  }

  /**
   * Logs in again with the stored credentials.
   *
   * @return the raw login response
   * @see SessionStore#relogin()
   */
  public TransportResponse relogin() {
    return session.relogin();
  }

  /**
   * Logs in again, reusing the stored value for any {@code null} or empty argument.
   *
   * @param username the username, or {@code null}
   * @param password the password, or {@code null}
   * @return the raw login response
   * @see SessionStore#relogin(String, String)
   */
  public TransportResponse relogin(@Nullable String username, @Nullable String password) {
    return session.relogin(username, password);
  }

  /**
   * Stores credentials for a later {@link #relogin()} without logging in.
   *
   * @param credentials the credentials to store
   */
  public void setLoginData(LoginCredentials credentials) {
    session.setLoginData(credentials);
  }

  /**
   * Logs out of the controller. Stored credentials are kept.
   *
   * @return the raw logout response, normally a redirect
   */
  public TransportResponse logout() {
    return session.logout();
  }

  // Raw requests

  /** Issues a GET without query parameters. */
  public TransportResponse get(String path) {
    return dispatcher.get(path);
  }

  /** Issues a GET with query parameters; an empty map sends no query string. */
  public TransportResponse get(String path, @Nullable Map<String, ?> queryParams) {
    return dispatcher.get(path, queryParams);
  }

  /** Issues a POST with an empty JSON object body. */
  public TransportResponse post(String path) {
    return dispatcher.post(path);
  }

  /** Issues a POST with a JSON object body. */
  public TransportResponse post(String path, @Nullable Map<String, ?> jsonBody) {
    return dispatcher.post(path, jsonBody);
  }

  /** Issues a PUT with an empty JSON object body. */
  public TransportResponse put(String path) {
    return dispatcher.put(path);
  }

  /** Issues a PUT with a JSON object body. */
  public TransportResponse put(String path, @Nullable Map<String, ?> jsonBody) {
    return dispatcher.put(path, jsonBody);
  }

  // Endpoints

  /** Lists the sites visible to the logged-in user ({@code GET /api/self/sites}). */
  public TransportResponse sites() {
    return dispatcher.get("/api/self/sites");
  }

  /**
   * Returns statistics for the connected clients of a site ({@code GET /api/s/{site}/stat/sta}).
   *
   * @param site the site identifier
   * @return the raw response
   */
  public TransportResponse statistics(String site) {
    return dispatcher.get("/api/s/" + Objects.requireNonNull(site, "site") + "/stat/sta");
  }

  /**
   * Returns statistics for the devices of a site ({@code GET /api/s/{site}/stat/device}).
   *
   * @param site the site identifier
   * @return the raw response
   */
  public TransportResponse deviceStatistics(String site) {
    return dispatcher.get("/api/s/" + Objects.requireNonNull(site, "site") + "/stat/device");
  }

  /** Authorizes a guest for the given number of minutes. */
  public TransportResponse authorizeGuest(String site, String mac, int minutes) {
    return commands.authorizeGuest(site, mac, minutes);
  }

  /** Authorizes a guest with typed upload, download and quota limits. */
  public TransportResponse authorizeGuest(
      String site, String mac, int minutes, GuestAuthorization limits) {
    return commands.authorizeGuest(site, mac, minutes, limits);
  }

  /**
   * Authorizes a guest with extra command fields, which win over {@code mac} and {@code minutes}
   * when their names collide.
   */
  public TransportResponse authorizeGuest(
      String site, String mac, int minutes, Map<String, ?> extra) {
    return commands.authorizeGuest(site, mac, minutes, extra);
  }

  /** Revokes a guest's authorization. */
  public TransportResponse unauthorizeGuest(String site, String mac) {
    return commands.unauthorizeGuest(site, mac);
  }

  /** Disconnects a client so that it reconnects. */
  public TransportResponse reconnectClient(String site, String mac) {
    return commands.reconnectClient(site, mac);
  }

  /** Builder for {@link UnifiClient}. */
  public static final class Builder {

    private final String baseUrl;
    private @Nullable UnifiTransport transport;
    private final Map<String, Object> options = new LinkedHashMap<>();
    private final Map<String, String> headers = new LinkedHashMap<>();

    /**
     * Creates a builder.
     *
     * @param baseUrl the controller base URL, e.g. {@code https://127.0.0.1:8443}
     */
    public Builder(String baseUrl) {
      this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
    }

    /** Sets the transport implementation. Defaults to a new {@link HttpClientTransport}. */
    public Builder transport(UnifiTransport transport) {
      this.transport = Objects.requireNonNull(transport, "transport");
      return this;
    }

    /**
     * Adds request options from a configuration map. Keys set here replace earlier values of the
     * same name, including those set by the typed setters.
     */
    public Builder options(Map<String, ?> options) {
      Objects.requireNonNull(options, "options");
      this.options.putAll(options);
      return this;
    }

    /** Sets the cookie jar. Defaults to a fresh {@link CookieManager}. */
    public Builder cookieJar(CookieManager cookieJar) {
      options.put(RequestOptions.COOKIES, Objects.requireNonNull(cookieJar, "cookieJar"));
      return this;
    }

    /** Sets the TLS verification policy. Defaults to {@link VerifyPolicy#disabled()}. */
    public Builder verify(VerifyPolicy verify) {
      options.put(RequestOptions.VERIFY, Objects.requireNonNull(verify, "verify"));
      return this;
    }

    /** Sets the request timeout. Defaults to none. */
    public Builder timeout(Duration timeout) {
      options.put(RequestOptions.TIMEOUT, Objects.requireNonNull(timeout, "timeout"));
      return this;
    }

    /** Adds a header sent with every request. */
    public Builder header(String name, String value) {
      headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
      options.put(RequestOptions.HEADERS, Map.copyOf(headers));
      return this;
    }

    /**
     * Builds the client.
     *
     * @return the configured client
     * @throws IllegalArgumentException if an option has an unsupported value type
     */
    public UnifiClient build() {
      return new UnifiClient(this);
    }
  }
}
