package io.github.wphillipmoore.edgegrid.exception;

/**
 * Thrown when a call's {@code RequestContext} was cancelled or its deadline passed.
 *
 * <p>Raised from the dispatch wait and from the retry sleep alike; it is never retried.
 */
public final class RequestCancelledException extends EdgeGridException {

  private static final long serialVersionUID = 1L;

  private final boolean deadlineExceeded;

  /**
   * Creates a cancellation exception.
   *
   * @param deadlineExceeded {@code true} if the deadline passed, {@code false} if cancelled
   */
  public RequestCancelledException(boolean deadlineExceeded) {
    super(deadlineExceeded ? "context deadline exceeded" : "context canceled");
    this.deadlineExceeded = deadlineExceeded;
  }

  /** Returns {@code true} if the context expired rather than being cancelled explicitly. */
  public boolean isDeadlineExceeded() {
    return deadlineExceeded;
  }
}
