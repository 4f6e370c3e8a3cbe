package io.github.wphillipmoore.edgegrid.exception;

/**
 * Base exception for all EdgeGrid client errors.
 *
 * <p>This is an unchecked exception hierarchy. Every message starts with a short prefix naming the
 * operation that failed, while the concrete subtype (and its fields) carries the details callers
 * match on.
 */
public sealed class EdgeGridException extends RuntimeException
    permits TransportException,
        RequestCancelledException,
        MarshalingException,
        UnmarshalingException,
        ApiException,
        ValidationException,
        ConfigurationException,
        RequestCreationException {

  private static final long serialVersionUID = 1L;

  /** Creates an exception with the given message. */
  public EdgeGridException(String message) {
    super(message);
  }

  /** Creates an exception with the given message and cause. */
  public EdgeGridException(String message, Throwable cause) {
    super(message, cause);
  }
}
