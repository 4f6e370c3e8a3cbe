package io.github.wphillipmoore.edgegrid.exception;

/** Thrown when a request body cannot be serialized to JSON. No request is sent. */
public final class MarshalingException extends EdgeGridException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a marshaling exception.
   *
   * @param message description of the failure
   * @param cause the serializer failure
   */
  public MarshalingException(String message, Throwable cause) {
    super(message, cause);
  }
}
