package io.github.wphillipmoore.unifi.client.options;

import java.net.CookieManager;
import java.net.CookiePolicy;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Transport-level options sent with every request a client issues.
 *
 * <p>Options are layered with later layers winning: built-in defaults, then the options supplied
 * at client construction, then per-call overrides. The defaults are a fresh {@link CookieManager}
 * as the cookie jar and TLS verification disabled. The cookie jar instance is shared by every
 * request built from the same options, so the session cookie captured at login is sent on all
 * later calls.
 *
 * <p>Recognized option names are the constants of this class. Any other key is passed through to
 * the transport unchanged. Instances are immutable apart from the cookie jar's own state, which
 * the transport updates from {@code Set-Cookie} responses.
 */
public final class RequestOptions {

  /** Cookie jar, a {@link CookieManager}. */
  public static final String COOKIES = "cookies";

  /** TLS verification: {@link Boolean}, certificate bundle path, or {@link VerifyPolicy}. */
  public static final String VERIFY = "verify";

  /** Request timeout, a {@link Duration}. */
  public static final String TIMEOUT = "timeout";

  /** Whether redirects are followed, a {@link Boolean}. Defaults to {@code true}. */
  public static final String ALLOW_REDIRECTS = "allow_redirects";

  /** Whether HTTP statuses of 400 and above raise an error, a {@link Boolean}. */
  public static final String HTTP_ERRORS = "http_errors";

  /** Extra request headers, a {@code Map<String, String>}. */
  public static final String HEADERS = "headers";

  private static final Set<String> SESSION_BOUND_KEYS = Set.of(COOKIES, VERIFY);

  private final Map<String, Object> values;

  private RequestOptions(Map<String, Object> values) {
    validate(values);
    this.values = Collections.unmodifiableMap(values);
  }

  /**
   * Returns the built-in defaults: a fresh cookie jar and TLS verification disabled.
   *
   * @return new default options with their own cookie jar
   */
  public static RequestOptions defaults() {
    return new RequestOptions(defaultValues());
  }

  /**
   * Creates options from a caller-supplied configuration map layered over the defaults.
   *
   * <p>A key supplied by the caller replaces the default of the same name; absent keys and keys
   * mapped to {@code null} keep the default.
   *
   * @param options caller options, may be empty
   * @return the effective options
   * @throws IllegalArgumentException if a recognized option has an unsupported value type
   */
  public static RequestOptions of(Map<String, ?> options) {
    Objects.requireNonNull(options, "options");
    return new RequestOptions(merge(defaultValues(), options));
  }

  /**
   * Returns these options with per-call overrides applied on top.
   *
   * <p>The cookie jar and verification policy are bound to the session and cannot be overridden
   * per call. The returned options share this instance's cookie jar.
   *
   * @param overrides per-call options, may be empty
   * @return the effective options for one call
   * @throws IllegalArgumentException if an override names {@link #COOKIES} or {@link #VERIFY}
   */
  public RequestOptions withCallOverrides(Map<String, ?> overrides) {
    Objects.requireNonNull(overrides, "overrides");
    if (overrides.isEmpty()) {
      return this;
    }
    for (String key : overrides.keySet()) {
      if (SESSION_BOUND_KEYS.contains(key)) {
        throw new IllegalArgumentException("Option '" + key + "' cannot be overridden per call");
      }
    }
    return new RequestOptions(merge(values, overrides));
  }

  /** Returns the shared cookie jar. */
  public CookieManager cookieJar() {
    return (CookieManager) values.get(COOKIES);
  }

  /** Returns the TLS verification policy derived from the {@link #VERIFY} option. */
  public VerifyPolicy verify() {
    return VerifyPolicy.from(values.get(VERIFY));
  }

  /** Returns the request timeout, or {@code null} if none is configured. */
  public @Nullable Duration timeout() {
    return (Duration) values.get(TIMEOUT);
  }

  /** Returns whether redirects are followed. Defaults to {@code true}. */
  public boolean allowRedirects() {
    return flag(ALLOW_REDIRECTS, true);
  }

  /** Returns whether HTTP error statuses raise an exception. Defaults to {@code true}. */
  public boolean httpErrors() {
    return flag(HTTP_ERRORS, true);
  }

  /** Returns the extra request headers. The returned map is unmodifiable. */
  @SuppressWarnings("unchecked")
  public Map<String, String> headers() {
    Object headers = values.get(HEADERS);
    return headers == null ? Map.of() : Collections.unmodifiableMap((Map<String, String>) headers);
  }

  /**
   * Returns the raw value of an option, or {@code null} if it is not set.
   *
   * @param name the option name
   * @return the raw value as supplied, or {@code null}
   */
  public @Nullable Object get(String name) {
    return values.get(name);
  }

  /** Returns every option as an unmodifiable map in insertion order. */
  public Map<String, Object> asMap() {
    return values;
  }

  @Override
  public String toString() {
    return "RequestOptions" + values.keySet();
  }

  private boolean flag(String name, boolean defaultValue) {
    Object value = values.get(name);
    return value == null ? defaultValue : (Boolean) value;
  }

  private static Map<String, Object> defaultValues() {
    Map<String, Object> defaults = new LinkedHashMap<>();
    defaults.put(COOKIES, new CookieManager(null, CookiePolicy.ACCEPT_ALL));
    defaults.put(VERIFY, Boolean.FALSE);
    return defaults;
  }

  static Map<String, Object> merge(Map<String, Object> base, Map<String, ?> overlay) {
    Map<String, Object> merged = new LinkedHashMap<>(base);
    overlay.forEach(
        (key, value) -> {
          if (value != null) {
            merged.put(Objects.requireNonNull(key, "option name"), value);
          }
        });
    return merged;
  }

  private static void validate(Map<String, Object> values) {
    requireType(values, COOKIES, CookieManager.class);
    VerifyPolicy.from(values.get(VERIFY));
    requireType(values, TIMEOUT, Duration.class);
    requireType(values, ALLOW_REDIRECTS, Boolean.class);
    requireType(values, HTTP_ERRORS, Boolean.class);
    requireType(values, HEADERS, Map.class);
    requireStringHeaders(values.get(HEADERS));
  }

  private static void requireStringHeaders(@Nullable Object headers) {
    if (!(headers instanceof Map<?, ?> map)) {
      return;
    }
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (!(entry.getKey() instanceof String) || !(entry.getValue() instanceof String)) {
        throw new IllegalArgumentException(
            "Option '"
                + HEADERS
                + "' must map header names to String values but has "
                + entry.getKey()
                + "="
                + entry.getValue());
      }
    }
  }

  private static void requireType(Map<String, Object> values, String name, Class<?> type) {
    Object value = values.get(name);
    if (value != null && !type.isInstance(value)) {
      throw new IllegalArgumentException(
          "Option '"
              + name
              + "' must be a "
              + type.getSimpleName()
              + " but was "
              + value.getClass().getName());
    }
  }
}
