package io.github.wphillipmoore.unifi.client;

import io.github.wphillipmoore.unifi.client.options.RequestOptions;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Immutable description of one HTTP call handed to a {@link UnifiTransport}.
 *
 * <p>The query map is copied and kept in insertion order; an empty map means no query string. The
 * JSON body is {@code null} for GET requests and a (possibly empty) object for POST and PUT.
 *
 * @param method the HTTP method
 * @param url fully-qualified URL without query string
 * @param query query parameters, never null
 * @param jsonBody JSON object body, or {@code null} for no body
 * @param options effective transport options for this call
 */
public record TransportRequest(
    HttpMethod method,
    String url,
    Map<String, Object> query,
    @Nullable Map<String, Object> jsonBody,
    RequestOptions options) {

  /** Validates non-null fields and defensively copies the query and body maps. */
  public TransportRequest {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(url, "url");
    query =
        Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(query, "query")));
    if (jsonBody != null) {
      jsonBody = Collections.unmodifiableMap(new LinkedHashMap<>(jsonBody));
    }
    Objects.requireNonNull(options, "options");
  }
}
