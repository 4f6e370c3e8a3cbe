package io.github.wphillipmoore.edgegrid;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;

/**
 * A fully resolved HTTP request as it goes on the wire.
 *
 * <p>Header names are case-insensitive. Headers are mutable so that a {@link
 * io.github.wphillipmoore.edgegrid.auth.Signer} can attach its authentication headers; the
 * dispatch chain only ever signs a {@linkplain #copy() copy}, so each redirect hop and retry
 * attempt carries its own signature.
 */
public final class TransportRequest {

  private final String method;
  private final URI uri;
  private final Map<String, String> headers;
  private final @Nullable String body;
  private final @Nullable Duration timeout;

  /**
   * Creates a transport request.
   *
   * @param method the HTTP method
   * @param uri the absolute request URI
   * @param headers the request headers (copied)
   * @param body the JSON body text, or {@code null} for none
   * @param timeout the per-attempt timeout, or {@code null} for none
   */
  public TransportRequest(
      String method,
      URI uri,
      Map<String, String> headers,
      @Nullable String body,
      @Nullable Duration timeout) {
    this.method = Objects.requireNonNull(method, "method");
    this.uri = Objects.requireNonNull(uri, "uri");
    this.headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    this.headers.putAll(Objects.requireNonNull(headers, "headers"));
    this.body = body;
    this.timeout = timeout;
  }

  /** Returns the HTTP method. */
  public String getMethod() {
    return method;
  }

  /** Returns the absolute request URI. */
  public URI getUri() {
    return uri;
  }

  /** Returns a read-only view of the headers. */
  public Map<String, String> getHeaders() {
    return Collections.unmodifiableMap(headers);
  }

  /** Returns the value of header {@code name}, or {@code null} if absent. */
  public @Nullable String getHeader(String name) {
    return headers.get(name);
  }

  /** Sets header {@code name}, replacing any previous value. */
  public void setHeader(String name, String value) {
    headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
  }

  /** Returns the body text, or {@code null} if the request has no body. */
  public @Nullable String getBody() {
    return body;
  }

  /** Returns the per-attempt timeout, or {@code null} for none. */
  public @Nullable Duration getTimeout() {
    return timeout;
  }

  /** Returns an independent copy with the same method, URI, headers and body. */
  public TransportRequest copy() {
    return new TransportRequest(method, uri, headers, body, timeout);
  }

  /**
   * Returns the request for the next redirect hop. The previous signature is dropped.
   *
   * @param location the resolved redirect target
   * @param switchToGet {@code true} to follow with a body-less {@code GET}
   * @return the next hop's request
   */
  public TransportRequest redirectTo(URI location, boolean switchToGet) {
    Map<String, String> nextHeaders = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    nextHeaders.putAll(headers);
    nextHeaders.remove("Authorization");
    if (switchToGet) {
      return new TransportRequest("GET", location, nextHeaders, null, timeout);
    }
    return new TransportRequest(method, location, nextHeaders, body, timeout);
  }

  @Override
  public String toString() {
    return method + " " + uri;
  }
}
