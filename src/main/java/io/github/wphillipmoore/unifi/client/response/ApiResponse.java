package io.github.wphillipmoore.unifi.client.response;

import com.google.gson.Gson;
import com.google.gson.JsonSyntaxException;
import io.github.wphillipmoore.unifi.client.TransportResponse;
import io.github.wphillipmoore.unifi.client.exception.UnifiApiException;
import io.github.wphillipmoore.unifi.client.exception.UnifiResponseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Parsed controller response of the form {@code {"meta": {"rc": ..., "msg": ...}, "data": [...]}}.
 *
 * <p>The client returns raw responses; this helper is for callers that want the controller's
 * result code and data rows. Numbers in {@code data} are Gson's default {@link Double} values.
 *
 * @param rc the {@code meta.rc} result code, or {@code null} if absent
 * @param msg the {@code meta.msg} message, or {@code null} if absent
 * @param data the {@code data} rows, never null, unmodifiable
 * @param payload the whole parsed body, never null, unmodifiable
 */
public record ApiResponse(
    @Nullable String rc,
    @Nullable String msg,
    List<Map<String, Object>> data,
    Map<String, Object> payload) {

  static final String RC_OK = "ok";

  private static final Gson GSON = new Gson();

  /** Validates non-null fields and defensively copies the data rows and payload. */
  public ApiResponse {
    data = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(data, "data")));
    payload =
        Collections.unmodifiableMap(
            new LinkedHashMap<>(Objects.requireNonNull(payload, "payload")));
  }

  /**
   * Parses a transport response body.
   *
   * @param response the raw response
   * @return the parsed response
   * @throws UnifiResponseException if the body is not a JSON object
   */
  public static ApiResponse parse(TransportResponse response) {
    Objects.requireNonNull(response, "response");
    return parse(response.body());
  }

  /**
   * Parses a controller response body.
   *
   * @param text the response body text
   * @return the parsed response
   * @throws UnifiResponseException if the text is not a JSON object
   */
  public static ApiResponse parse(String text) {
    Map<String, Object> payload = parsePayload(text);
    String rc = null;
    String msg = null;
    Object meta = payload.get("meta");
    if (meta instanceof Map<?, ?> metaMap) {
      rc = stringOrNull(metaMap.get("rc"));
      msg = stringOrNull(metaMap.get("msg"));
    }
    return new ApiResponse(rc, msg, extractData(payload), payload);
  }

  /** Returns whether {@code meta.rc} is {@code "ok"}. */
  public boolean isOk() {
    return RC_OK.equals(rc);
  }

  /**
   * Returns this response if {@code meta.rc} is {@code "ok"}.
   *
   * @return this response
   * @throws UnifiApiException if the controller reported an error
   */
  public ApiResponse requireOk() {
    if (!isOk()) {
      throw new UnifiApiException(
          "Controller returned rc=" + rc + (msg != null ? " (" + msg + ")" : ""), payload, msg);
    }
    return this;
  }

  static Map<String, Object> parsePayload(String text) {
    try {
      Object decoded = GSON.fromJson(text, Object.class);
      if (!(decoded instanceof Map)) {
        throw new UnifiResponseException("Response is not a JSON object", text);
      }
      @SuppressWarnings("unchecked")
      Map<String, Object> result = (Map<String, Object>) decoded;
      return result;
    } catch (JsonSyntaxException e) {
      throw new UnifiResponseException("Invalid JSON in response", text, e);
    }
  }

  @SuppressWarnings("unchecked")
  static List<Map<String, Object>> extractData(Map<String, Object> payload) {
    Object data = payload.get("data");
    if (data == null) {
      return List.of();
    }
    if (!(data instanceof List)) {
      throw new UnifiResponseException("Response field 'data' is not a list", GSON.toJson(payload));
    }
    List<Map<String, Object>> rows = new ArrayList<>();
    for (Object item : (List<Object>) data) {
      if (!(item instanceof Map)) {
        throw new UnifiResponseException(
            "Response field 'data' contains a non-object entry", GSON.toJson(payload));
      }
      rows.add((Map<String, Object>) item);
    }
    return rows;
  }

  private static @Nullable String stringOrNull(@Nullable Object value) {
    return value != null ? value.toString() : null;
  }
}
