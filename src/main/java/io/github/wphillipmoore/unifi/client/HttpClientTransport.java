package io.github.wphillipmoore.unifi.client;

import com.google.gson.Gson;
import io.github.wphillipmoore.unifi.client.exception.UnifiTransportException;
import io.github.wphillipmoore.unifi.client.options.RequestOptions;
import io.github.wphillipmoore.unifi.client.options.VerifyPolicy;
import java.io.IOException;
import java.io.InputStream;
import java.lang.invoke.MethodHandles;
import java.lang.ref.WeakReference;
import java.net.CookieHandler;
import java.net.CookieManager;
import java.net.Socket;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.WeakHashMap;
import java.util.function.BiFunction;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509ExtendedTrustManager;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JDK {@link HttpClient}-based implementation of {@link UnifiTransport}.
 *
 * <p>Uses {@link java.net.http.HttpClient} for HTTP communication and Gson for JSON serialization.
 * An {@link HttpClient} fixes its cookie handler, TLS context and redirect policy when it is built,
 * so one client is built and cached per distinct combination of cookie jar, verification policy
 * and redirect setting. The cookie jar is held by identity: requests carrying the same jar share a
 * client and therefore the same session cookies.
 *
 * <p>Cached clients are held weakly by their cookie jar. A transport shared by many {@link
 * UnifiClient}s drops the clients of a session once its cookie jar is no longer reachable, and the
 * JDK then stops their selector threads.
 */
public final class HttpClientTransport implements UnifiTransport {

  private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

  private final Gson gson = new Gson();
  private final BiFunction<CookieHandler, ClientSettings, HttpClient> clientFactory;

  // Values must not reference their key strongly, see WeakCookieHandler.
  private final Map<CookieManager, Map<ClientSettings, HttpClient>> clients = new WeakHashMap<>();

  /** Creates a transport that builds JDK HTTP clients on demand. */
  public HttpClientTransport() {
    this(HttpClientTransport::buildClient);
  }

  /**
   * Creates a transport with an injected client factory. Package-private for testing.
   *
   * @param clientFactory builds the HTTP client for a cookie handler and settings combination
   */
  HttpClientTransport(BiFunction<CookieHandler, ClientSettings, HttpClient> clientFactory) {
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
  }

  /**
   * The settings, besides the cookie jar, that an {@link HttpClient} is built from.
   *
   * @param verify the TLS verification policy
   * @param followRedirects whether redirects are followed
   */
  record ClientSettings(VerifyPolicy verify, boolean followRedirects) {}

  @Override
  @SuppressWarnings("PMD.CloseResource") // HttpClient is managed by this transport, not disposable
  public TransportResponse send(TransportRequest request) {
    Objects.requireNonNull(request, "request");
    RequestOptions options = request.options();
    String url = request.url();

    HttpClient activeClient;
    try {
      activeClient = clientFor(options);
    } catch (IllegalStateException e) {
      throw new UnifiTransportException("TLS configuration failed", url, e);
    }

    HttpRequest.Builder requestBuilder =
        HttpRequest.newBuilder()
            .uri(URI.create(url + encodeQuery(url, request.query())))
            .header("Accept", "application/json");

    if (request.jsonBody() != null) {
      String json = gson.toJson(request.jsonBody());
      requestBuilder
          .header("Content-Type", "application/json")
          .method(request.method().name(), HttpRequest.BodyPublishers.ofString(json));
    } else {
      requestBuilder.method(request.method().name(), HttpRequest.BodyPublishers.noBody());
    }

    options.headers().forEach(requestBuilder::header);

    Duration timeout = options.timeout();
    if (timeout != null) {
      requestBuilder.timeout(timeout);
    }

    HttpResponse<String> response;
    try {
      response = activeClient.send(requestBuilder.build(), HttpResponse.BodyHandlers.ofString());
    } catch (HttpTimeoutException e) {
      throw new UnifiTransportException("HTTP request timed out", url, e);
    } catch (IOException e) {
      throw new UnifiTransportException("HTTP request failed", url, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new UnifiTransportException("HTTP request interrupted", url, e);
    }

    int status = response.statusCode();
    String body = response.body() != null ? response.body() : "";
    if (options.httpErrors() && status >= 400) {
      throw new UnifiTransportException(
          request.method() + " " + url + " returned HTTP " + status, url, status, body);
    }
    return new TransportResponse(status, body, flattenHeaders(response.headers()));
  }

  private HttpClient clientFor(RequestOptions options) {
    CookieManager cookieJar = options.cookieJar();
    ClientSettings settings = new ClientSettings(options.verify(), options.allowRedirects());
    synchronized (clients) {
      return clients
          .computeIfAbsent(cookieJar, jar -> new HashMap<>())
          .computeIfAbsent(
              settings, key -> clientFactory.apply(new WeakCookieHandler(cookieJar), key));
    }
  }

  /** Returns the number of cookie jars that currently have cached clients. */
  int cachedCookieJarCount() {
    synchronized (clients) {
      return clients.size();
    }
  }

  static HttpClient buildClient(CookieHandler cookieHandler, ClientSettings settings) {
    LOG.debug(
        "Building HTTP client (verify={}, followRedirects={})",
        settings.verify(),
        settings.followRedirects());
    HttpClient.Builder builder =
        HttpClient.newBuilder()
            .cookieHandler(cookieHandler)
            .followRedirects(
                settings.followRedirects()
                    ? HttpClient.Redirect.NORMAL
                    : HttpClient.Redirect.NEVER);
    VerifyPolicy verify = settings.verify();
    if (verify instanceof VerifyPolicy.Disabled) {
      LOG.warn("TLS certificate verification is disabled for controller connections");
      builder.sslContext(createTrustAllContext("TLS"));
    } else if (verify instanceof VerifyPolicy.CertificateBundle bundle) {
      builder.sslContext(createBundleContext(bundle.path()));
    }
    return builder.build();
  }

  /**
   * Creates an {@link SSLContext} with a trust-all manager.
   *
   * @param protocol the SSL protocol name (e.g. "TLS")
   * @return an initialized SSLContext that trusts all certificates
   * @throws IllegalStateException if the protocol is not available
   */
  static SSLContext createTrustAllContext(String protocol) {
    try {
      SSLContext sslContext = SSLContext.getInstance(protocol);
      sslContext.init(null, new TrustManager[] {new TrustAllManager()}, null);
      return sslContext;
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Failed to create SSLContext", e);
    }
  }

  /**
   * Creates an {@link SSLContext} that trusts exactly the certificates in a PEM bundle.
   *
   * @param bundle path to the PEM file
   * @return an initialized SSLContext
   * @throws IllegalStateException if the bundle cannot be read or holds no certificates
   */
  static SSLContext createBundleContext(Path bundle) {
    try (InputStream in = Files.newInputStream(bundle)) {
      Collection<? extends Certificate> certificates =
          CertificateFactory.getInstance("X.509").generateCertificates(in);
      if (certificates.isEmpty()) {
        throw new IllegalStateException("No certificates found in " + bundle);
      }
      KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
      trustStore.load(null, null);
      int index = 0;
      for (Certificate certificate : certificates) {
        trustStore.setCertificateEntry("controller-" + index++, certificate);
      }
      TrustManagerFactory trustManagerFactory =
          TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
      trustManagerFactory.init(trustStore);
      SSLContext sslContext = SSLContext.getInstance("TLS");
      sslContext.init(null, trustManagerFactory.getTrustManagers(), null);
      return sslContext;
    } catch (IOException | GeneralSecurityException e) {
      throw new IllegalStateException("Failed to load certificate bundle " + bundle, e);
    }
  }

  /**
   * Encodes query parameters as a query string in insertion order.
   *
   * <p>Parameters with a {@code null} value are left out. An {@link Iterable} value is sent as one
   * {@code name=value} pair per non-null element, so {@code {mac: [a, b]}} becomes {@code
   * mac=a&mac=b}.
   *
   * @param url the URL the query is appended to
   * @param query the query parameters
   * @return the query string including its leading separator, or an empty string if none
   */
  static String encodeQuery(String url, Map<String, Object> query) {
    StringJoiner joiner = new StringJoiner("&", url.contains("?") ? "&" : "?", "");
    joiner.setEmptyValue("");
    query.forEach(
        (name, value) -> {
          if (value instanceof Iterable<?> values) {
            for (Object element : values) {
              addQueryPair(joiner, name, element);
            }
          } else {
            addQueryPair(joiner, name, value);
          }
        });
    return joiner.toString();
  }

  private static void addQueryPair(StringJoiner joiner, String name, @Nullable Object value) {
    if (value != null) {
      joiner.add(
          URLEncoder.encode(name, StandardCharsets.UTF_8)
              + "="
              + URLEncoder.encode(String.valueOf(value), StandardCharsets.UTF_8));
    }
  }

  /**
   * Flattens {@link HttpHeaders} multi-value map to single-value map per RFC 9110 section 5.3.
   *
   * <p>Multiple values for the same header name are joined with {@code ", "}.
   *
   * @param httpHeaders the HTTP response headers
   * @return a flattened string-to-string header map
   */
  static Map<String, String> flattenHeaders(HttpHeaders httpHeaders) {
    Map<String, String> result = new LinkedHashMap<>();
    httpHeaders.map().forEach((name, values) -> result.put(name, String.join(", ", values)));
    return result;
  }

  /**
   * Delegates to a cookie jar through a weak reference, so that a cached client does not keep its
   * session's jar alive. Cookies are neither sent nor stored once the jar is gone.
   */
  static final class WeakCookieHandler extends CookieHandler {

    private final WeakReference<CookieManager> cookieJar;

    WeakCookieHandler(CookieManager cookieJar) {
      this.cookieJar = new WeakReference<>(cookieJar);
    }

    @Override
    public Map<String, List<String>> get(URI uri, Map<String, List<String>> requestHeaders)
        throws IOException {
      CookieManager jar = cookieJar.get();
      return jar != null ? jar.get(uri, requestHeaders) : Map.of();
    }

    @Override
    public void put(URI uri, Map<String, List<String>> responseHeaders) throws IOException {
      CookieManager jar = cookieJar.get();
      if (jar != null) {
        jar.put(uri, responseHeaders);
      }
    }

    @Nullable CookieManager cookieJar() {
      return cookieJar.get();
    }
  }

  /**
   * A trust manager that accepts all certificates and skips host name verification. Used when TLS
   * verification is disabled.
   *
   * <p>It extends {@link X509ExtendedTrustManager}: the JDK wraps a plain {@link
   * javax.net.ssl.X509TrustManager} and still checks the host name against the certificate.
   */
  static final class TrustAllManager extends X509ExtendedTrustManager {

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) {
      // Accept all client certificates
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {
      // Accept all client certificates
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
      // Accept all client certificates
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) {
      // Accept all server certificates
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {
      // Accept any server certificate and host name
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
      // Accept any server certificate and host name
    }

    @Override
    public X509Certificate[] getAcceptedIssuers() {
      return new X509Certificate[0];
    }
  }
}
