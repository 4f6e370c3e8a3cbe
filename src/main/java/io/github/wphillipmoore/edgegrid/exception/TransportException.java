package io.github.wphillipmoore.edgegrid.exception;

import java.util.Objects;

/**
 * Thrown when a network or connection failure occurs and no HTTP response is available.
 *
 * <p>The {@code method} is recorded so the retry engine can tell which request failed without a
 * response to inspect.
 */
public final class TransportException extends EdgeGridException {

  private static final long serialVersionUID = 1L;

  private final String method;
  private final String url;

  /**
   * Creates a transport exception.
   *
   * @param message description of the failure
   * @param method the HTTP method of the failed request
   * @param url the URL that was being accessed
   */
  public TransportException(String message, String method, String url) {
    super(message);
    this.method = Objects.requireNonNull(method, "method");
    this.url = Objects.requireNonNull(url, "url");
  }

  /**
   * Creates a transport exception with a cause.
   *
   * @param message description of the failure
   * @param method the HTTP method of the failed request
   * @param url the URL that was being accessed
   * @param cause the underlying cause
   */
  public TransportException(String message, String method, String url, Throwable cause) {
    super(message, cause);
    this.method = Objects.requireNonNull(method, "method");
    this.url = Objects.requireNonNull(url, "url");
  }

  /** Returns the HTTP method of the request that failed. */
  public String getMethod() {
    return method;
  }

  /** Returns the URL that was being accessed when the failure occurred. */
  public String getUrl() {
    return url;
  }
}
