package io.github.wphillipmoore.edgegrid;

import io.github.wphillipmoore.edgegrid.exception.TransportException;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import javax.net.ssl.SSLContext;

/**
 * JDK {@link HttpClient}-based implementation of {@link EdgeGridTransport}.
 *
 * <p>Redirects are not followed here: the session follows them itself so that every hop is signed
 * again. The exchange runs asynchronously and the calling thread waits on it through {@link
 * RequestContext#await}, so cancelling the context abandons the request promptly.
 */
public final class HttpClientTransport implements EdgeGridTransport {

  /** Headers the JDK client computes itself and refuses to accept from callers. */
  static final Set<String> RESTRICTED_HEADERS =
      Set.of("connection", "content-length", "expect", "host", "upgrade");

  private final HttpClient client;

  /** Creates a transport with a default TLS-verifying {@link HttpClient}. */
  public HttpClientTransport() {
    this.client = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NEVER).build();
  }

  /**
   * Creates a transport with a custom {@link SSLContext}, e.g. for a private trust store.
   *
   * @param sslContext the SSL context to use
   */
  public HttpClientTransport(SSLContext sslContext) {
    Objects.requireNonNull(sslContext, "sslContext");
    this.client =
        HttpClient.newBuilder()
            .sslContext(sslContext)
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();
  }

  /**
   * Creates a transport with an injected {@link HttpClient}. Package-private for testing.
   *
   * @param client the HTTP client to use
   */
  HttpClientTransport(HttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  @SuppressWarnings("PMD.CloseResource") // HttpClient is managed by this transport, not disposable
  public TransportResponse send(TransportRequest request, RequestContext context) {
    String url = request.getUri().toString();
    context.throwIfDone();

    HttpRequest httpRequest;
    try {
      httpRequest = buildRequest(request);
    } catch (IllegalArgumentException e) {
      throw new TransportException(
          "invalid request: " + e.getMessage(), request.getMethod(), url, e);
    }

    CompletableFuture<HttpResponse<String>> pending =
        client.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    HttpResponse<String> response;
    try {
      response = context.await(pending);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw new TransportException(
          "HTTP request failed: " + cause, request.getMethod(), url, cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      pending.cancel(true);
      throw new TransportException("HTTP request interrupted", request.getMethod(), url, e);
    }

    String body = response.body() != null ? response.body() : "";
    return new TransportResponse(response.statusCode(), body, flattenHeaders(response.headers()));
  }

  static HttpRequest buildRequest(TransportRequest request) {
    String body = request.getBody();
    HttpRequest.BodyPublisher publisher =
        body != null
            ? HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8)
            : HttpRequest.BodyPublishers.noBody();
    HttpRequest.Builder builder =
        HttpRequest.newBuilder().uri(request.getUri()).method(request.getMethod(), publisher);
    request
        .getHeaders()
        .forEach(
            (name, value) -> {
              if (!RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                builder.header(name, value);
              }
            });
    if (request.getTimeout() != null) {
      builder.timeout(request.getTimeout());
    }
    return builder.build();
  }

  /**
   * Flattens {@link HttpHeaders} multi-value map to single-value map per RFC 9110 section 5.3.
   *
   * <p>Multiple values for the same header name are joined with {@code ", "}.
   *
   * @param httpHeaders the HTTP response headers
   * @return a flattened string-to-string header map
   */
  static Map<String, String> flattenHeaders(HttpHeaders httpHeaders) {
    Map<String, String> result = new LinkedHashMap<>();
    httpHeaders.map().forEach((name, values) -> result.put(name, String.join(", ", values)));
    return result;
  }
}
