package io.github.wphillipmoore.edgegrid.exception;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.Serializable;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Problem-details error reported by the remote API, plus the HTTP status code of the response.
 *
 * <p>Text fields are never null; anything missing from the body is an empty string. Two errors are
 * the same kind of failure when {@link #matches(ApiError)} holds, which ignores the location
 * fields so callers can compare against a literal built from type, title, detail and status.
 *
 * @param type the problem type URI or code
 * @param title short summary
 * @param detail human-readable explanation
 * @param instance the problem instance, may be empty
 * @param behaviorName the rule behavior the problem relates to, may be empty
 * @param errorLocation JSON pointer into the submitted rule tree, may be empty
 * @param statusCode the HTTP status code of the response
 */
public record ApiError(
    String type,
    String title,
    String detail,
    String instance,
    String behaviorName,
    String errorLocation,
    int statusCode)
    implements Serializable {

  private static final Gson GSON = new Gson();

  /** Replaces null text fields with empty strings. */
  public ApiError {
    type = Objects.requireNonNullElse(type, "");
    title = Objects.requireNonNullElse(title, "");
    detail = Objects.requireNonNullElse(detail, "");
    instance = Objects.requireNonNullElse(instance, "");
    behaviorName = Objects.requireNonNullElse(behaviorName, "");
    errorLocation = Objects.requireNonNullElse(errorLocation, "");
  }

  /**
   * Creates an error carrying only the fields used for matching.
   *
   * @param type the problem type
   * @param title short summary
   * @param detail human-readable explanation
   * @param statusCode the HTTP status code
   */
  public ApiError(String type, String title, String detail, int statusCode) {
    this(type, title, detail, "", "", "", statusCode);
  }

  /**
   * Decodes an error response body. Never throws: an empty or malformed body yields an error
   * carrying only {@code statusCode}.
   *
   * @param body the raw response body, may be null
   * @param statusCode the HTTP status code of the response
   * @return the decoded error
   */
  public static ApiError parse(@Nullable String body, int statusCode) {
    if (body == null || body.isBlank()) {
      return new ApiError("", "", "", statusCode);
    }
    try {
      JsonElement element = JsonParser.parseString(body);
      if (!element.isJsonObject()) {
        return new ApiError("", "", "", statusCode);
      }
      Fields fields = GSON.fromJson(element.getAsJsonObject(), Fields.class);
      return new ApiError(
          fields.type,
          fields.title,
          fields.detail,
          fields.instance,
          fields.behaviorName,
          fields.errorLocation,
          statusCode);
    } catch (JsonParseException | IllegalStateException | NumberFormatException e) {
      return new ApiError("", "", "", statusCode);
    }
  }

  /**
   * Returns whether {@code other} describes the same failure: equal type, title, detail and
   * status code.
   */
  public boolean matches(@Nullable ApiError other) {
    return other != null
        && statusCode == other.statusCode
        && type.equals(other.type)
        && title.equals(other.title)
        && detail.equals(other.detail);
  }

  /** Returns {@code true} when the remote resource was not found (status 404). */
  public boolean isNotFound() {
    return statusCode == 404;
  }

  /** Renders the populated fields as a compact JSON object. */
  public String describe() {
    JsonObject json = new JsonObject();
    json.addProperty("type", type);
    putIfPresent(json, "title", title);
    json.addProperty("detail", detail);
    putIfPresent(json, "instance", instance);
    putIfPresent(json, "behaviorName", behaviorName);
    putIfPresent(json, "errorLocation", errorLocation);
    json.addProperty("statusCode", statusCode);
    return json.toString();
  }

  private static void putIfPresent(JsonObject json, String name, String value) {
    if (!value.isEmpty()) {
      json.addProperty(name, value);
    }
  }

  /** Wire shape of the problem-details body. */
  private static final class Fields {
    String type;
    String title;
    String detail;
    String instance;
    String behaviorName;
    String errorLocation;
  }
}
