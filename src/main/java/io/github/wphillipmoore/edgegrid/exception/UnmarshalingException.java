package io.github.wphillipmoore.edgegrid.exception;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when a successful response body does not decode into the expected type.
 *
 * <p>The raw body is kept for diagnostics.
 */
public final class UnmarshalingException extends EdgeGridException {

  private static final long serialVersionUID = 1L;

  private final int statusCode;
  private final String responseText;

  /**
   * Creates an unmarshaling exception.
   *
   * @param message description of the failure
   * @param statusCode the HTTP status code of the response
   * @param responseText the raw response text, never null
   * @param cause the decoder failure, or {@code null}
   */
  public UnmarshalingException(
      String message, int statusCode, String responseText, @Nullable Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
    this.responseText = Objects.requireNonNull(responseText, "responseText");
  }

  /** Returns the HTTP status code of the response that failed to decode. */
  public int getStatusCode() {
    return statusCode;
  }

  /** Returns the raw response text. */
  public String getResponseText() {
    return responseText;
  }
}
