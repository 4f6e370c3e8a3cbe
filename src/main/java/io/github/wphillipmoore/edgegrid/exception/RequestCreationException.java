package io.github.wphillipmoore.edgegrid.exception;

/** Thrown when a request URL cannot be built from the request descriptor. No request is sent. */
public final class RequestCreationException extends EdgeGridException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a request creation exception.
   *
   * @param message description of the failure
   * @param cause the underlying failure
   */
  public RequestCreationException(String message, Throwable cause) {
    super(message, cause);
  }
}
