package io.github.wphillipmoore.unifi.client;

import io.github.wphillipmoore.unifi.client.options.RequestOptions;
import java.lang.invoke.MethodHandles;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds and executes HTTP calls against one controller.
 *
 * <p>Every call resolves its path against the base URL, attaches the shared {@link RequestOptions}
 * and hands the request to the {@link UnifiTransport}. The call payload (query parameters or JSON
 * body) never replaces the cookie jar or verification policy; those always come from the options.
 * Status codes are not interpreted here. Whether an HTTP error raises is a transport setting.
 */
public final class RequestDispatcher {

  private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

  private final String baseUrl;
  private final UnifiTransport transport;
  private final RequestOptions options;

  /**
   * Creates a dispatcher.
   *
   * @param baseUrl the controller base URL, e.g. {@code https://127.0.0.1:8443}
   * @param transport the transport that performs HTTP calls
   * @param options the options shared by every call
   */
  public RequestDispatcher(String baseUrl, UnifiTransport transport, RequestOptions options) {
    this.baseUrl = stripTrailingSlashes(Objects.requireNonNull(baseUrl, "baseUrl"));
    this.transport = Objects.requireNonNull(transport, "transport");
    this.options = Objects.requireNonNull(options, "options");
  }

  /** Returns the controller base URL without trailing slashes. */
  public String getBaseUrl() {
    return baseUrl;
  }

  /** Returns the options shared by every call. */
  public RequestOptions getOptions() {
    return options;
  }

  /**
   * Issues a GET without query parameters.
   *
   * @param path path relative to the base URL
   * @return the raw response
   */
  public TransportResponse get(String path) {
    return get(path, null);
  }

  /**
   * Issues a GET. Non-empty parameters are sent as the URL query; empty or {@code null} parameters
   * send no query string.
   *
   * @param path path relative to the base URL
   * @param queryParams query parameters, or {@code null}
   * @return the raw response
   */
  public TransportResponse get(String path, @Nullable Map<String, ?> queryParams) {
    return get(path, queryParams, Map.of());
  }

  /**
   * Issues a GET with per-call option overrides.
   *
   * @param path path relative to the base URL
   * @param queryParams query parameters, or {@code null}
   * @param overrides per-call options such as {@link RequestOptions#ALLOW_REDIRECTS}
   * @return the raw response
   */
  public TransportResponse get(
      String path, @Nullable Map<String, ?> queryParams, Map<String, ?> overrides) {
    Map<String, Object> query = new LinkedHashMap<>();
    if (queryParams != null) {
      query.putAll(queryParams);
    }
    return dispatch(HttpMethod.GET, path, query, null, overrides);
  }

  /**
   * Issues a POST with an empty JSON object body.
   *
   * @param path path relative to the base URL
   * @return the raw response
   */
  public TransportResponse post(String path) {
    return post(path, null);
  }

  /**
   * Issues a POST with a JSON body. A {@code null} or empty body is sent as {@code {}}.
   *
   * @param path path relative to the base URL
   * @param jsonBody fields of the JSON object body, or {@code null}
   * @return the raw response
   */
  public TransportResponse post(String path, @Nullable Map<String, ?> jsonBody) {
    return dispatch(HttpMethod.POST, path, Map.of(), body(jsonBody), Map.of());
  }

  /**
   * Issues a PUT with an empty JSON object body.
   *
   * @param path path relative to the base URL
   * @return the raw response
   */
  public TransportResponse put(String path) {
    return put(path, null);
  }

  /**
   * Issues a PUT with a JSON body. A {@code null} or empty body is sent as {@code {}}.
   *
   * @param path path relative to the base URL
   * @param jsonBody fields of the JSON object body, or {@code null}
   * @return the raw response
   */
  public TransportResponse put(String path, @Nullable Map<String, ?> jsonBody) {
    return dispatch(HttpMethod.PUT, path, Map.of(), body(jsonBody), Map.of());
  }

  private TransportResponse dispatch(
      HttpMethod method,
      String path,
      Map<String, Object> query,
      @Nullable Map<String, Object> jsonBody,
      Map<String, ?> overrides) {
    String url = buildUrl(Objects.requireNonNull(path, "path"));
    LOG.debug("{} {}", method, url);
    TransportRequest request =
        new TransportRequest(method, url, query, jsonBody, options.withCallOverrides(overrides));
    return transport.send(request);
  }

  private static Map<String, Object> body(@Nullable Map<String, ?> jsonBody) {
    Map<String, Object> body = new LinkedHashMap<>();
    if (jsonBody != null) {
      body.putAll(jsonBody);
    }
    return body;
  }

  String buildUrl(String path) {
    if (path.isEmpty()) {
      return baseUrl;
    }
    return path.startsWith("/") ? baseUrl + path : baseUrl + "/" + path;
  }

  static String stripTrailingSlashes(String url) {
    int end = url.length();
    while (end > 0 && url.charAt(end - 1) == '/') {
      end--;
    }
    return url.substring(0, end);
  }
}
