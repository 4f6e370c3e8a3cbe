package io.github.wphillipmoore.edgegrid.exception;

import java.util.Objects;

/**
 * Thrown by endpoint methods when the API answers with an unexpected status code.
 *
 * <p>The decoded {@link ApiError} is available through {@link #getError()}; {@link #is(ApiError)}
 * and {@link #isNotFound()} cover the usual checks without inspecting every field.
 */
public final class ApiException extends EdgeGridException {

  private static final long serialVersionUID = 1L;

  private final String operation;
  private final ApiError error;

  /**
   * Creates an API exception.
   *
   * @param operation short name of the failing operation, used as the message prefix
   * @param error the decoded API error
   */
  public ApiException(String operation, ApiError error) {
    super(
        Objects.requireNonNull(operation, "operation")
            + ": API error: "
            + Objects.requireNonNull(error, "error").describe());
    this.operation = operation;
    this.error = error;
  }

  /**
   * Decodes {@code body} into an {@link ApiError} and wraps it.
   *
   * @param operation short name of the failing operation
   * @param body the raw response body
   * @param statusCode the HTTP status code
   * @return the exception, ready to throw
   */
  public static ApiException fromResponse(String operation, String body, int statusCode) {
    return new ApiException(operation, ApiError.parse(body, statusCode));
  }

  /** Returns the operation that failed. */
  public String getOperation() {
    return operation;
  }

  /** Returns the decoded API error. */
  public ApiError getError() {
    return error;
  }

  /** Returns the HTTP status code of the failed response. */
  public int getStatusCode() {
    return error.statusCode();
  }

  /** Returns whether the wrapped error {@linkplain ApiError#matches matches} {@code expected}. */
  public boolean is(ApiError expected) {
    return error.matches(expected);
  }

  /** Returns {@code true} when the remote resource was not found. */
  public boolean isNotFound() {
    return error.isNotFound();
  }
}
