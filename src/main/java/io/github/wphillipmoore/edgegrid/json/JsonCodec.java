package io.github.wphillipmoore.edgegrid.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonIOException;
import com.google.gson.JsonParseException;
import io.github.wphillipmoore.edgegrid.exception.MarshalingException;
import io.github.wphillipmoore.edgegrid.exception.UnmarshalingException;
import java.lang.reflect.Type;
import java.util.Objects;

/**
 * Shared Gson configuration for request and response payloads.
 *
 * <p>Nulls are serialized (so {@code "description": null} and {@code "description": ""} stay
 * distinct on the wire) except for properties marked {@link OmitEmpty}. HTML escaping is off so
 * rule values such as {@code <} and {@code =} pass through verbatim.
 */
public final class JsonCodec {

  private static final JsonCodec DEFAULT = new JsonCodec();

  private final Gson gson;

  private JsonCodec() {
    this.gson =
        new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .registerTypeAdapterFactory(new OmitEmptyAdapterFactory())
            .create();
  }

  /** Returns the shared codec. */
  public static JsonCodec getDefault() {
    return DEFAULT;
  }

  /** Returns the configured Gson instance. */
  public Gson gson() {
    return gson;
  }

  /**
   * Serializes a request body.
   *
   * @param value the body to serialize
   * @return the JSON text
   * @throws MarshalingException if the value cannot be represented as JSON
   */
  public String marshal(Object value) {
    Objects.requireNonNull(value, "value");
    try {
      return gson.toJson(value);
    } catch (JsonIOException | IllegalArgumentException e) {
      throw new MarshalingException("marshaling request body: " + e.getMessage(), e);
    }
  }

  /**
   * Decodes a response body.
   *
   * @param text the raw response text
   * @param type the target type
   * @param statusCode the response status code, kept on failure
   * @param <T> the target type
   * @return the decoded value, never null
   * @throws UnmarshalingException if the text is empty or does not fit {@code type}
   */
  public <T> T unmarshal(String text, Type type, int statusCode) {
    T value;
    try {
      value = gson.fromJson(text, type);
    } catch (JsonParseException | IllegalStateException | NumberFormatException e) {
      throw new UnmarshalingException(
          "unmarshaling response body: " + e.getMessage(), statusCode, text, e);
    }
    if (value == null) {
      throw new UnmarshalingException(
          "unmarshaling response body: unexpected end of JSON input", statusCode, text, null);
    }
    return value;
  }
}
