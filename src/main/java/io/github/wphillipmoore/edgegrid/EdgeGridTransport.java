package io.github.wphillipmoore.edgegrid;

/**
 * Transport interface for EdgeGrid HTTP communication.
 *
 * <p>Implementations send exactly what they are given and return whatever status the server
 * answers with. They throw {@link io.github.wphillipmoore.edgegrid.exception.TransportException}
 * when no response is available and {@link
 * io.github.wphillipmoore.edgegrid.exception.RequestCancelledException} when the context ends
 * first. Decorators (signing, throttling, retries, tracing) implement the same interface.
 */
@FunctionalInterface
public interface EdgeGridTransport {

  /**
   * Sends one request.
   *
   * @param request the request to send
   * @param context the call context
   * @return the transport response
   */
  TransportResponse send(TransportRequest request, RequestContext context);
}
