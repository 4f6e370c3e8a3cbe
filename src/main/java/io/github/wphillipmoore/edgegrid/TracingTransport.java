package io.github.wphillipmoore.edgegrid;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;

/** Dumps every wire request and response to the call's logger at debug level. */
final class TracingTransport implements EdgeGridTransport {

  private final EdgeGridTransport delegate;
  private final Function<RequestContext, Logger> loggers;

  TracingTransport(EdgeGridTransport delegate, Function<RequestContext, Logger> loggers) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.loggers = Objects.requireNonNull(loggers, "loggers");
  }

  @Override
  public TransportResponse send(TransportRequest request, RequestContext context) {
    Logger logger = loggers.apply(context);
    if (logger.isDebugEnabled()) {
      logger.debug("HTTP Request:\n{}", dumpRequest(request));
    }
    TransportResponse response = delegate.send(request, context);
    if (logger.isDebugEnabled()) {
      logger.debug("HTTP Response:\n{}", dumpResponse(response));
    }
    return response;
  }

  static String dumpRequest(TransportRequest request) {
    StringBuilder out = new StringBuilder(256);
    out.append(request.getMethod()).append(' ').append(request.getUri()).append('\n');
    appendHeaders(out, request.getHeaders());
    if (request.getBody() != null) {
      out.append('\n').append(request.getBody());
    }
    return out.toString();
  }

  static String dumpResponse(TransportResponse response) {
    StringBuilder out = new StringBuilder(256);
    out.append(response.statusCode()).append('\n');
    appendHeaders(out, response.headers());
    if (!response.body().isEmpty()) {
      out.append('\n').append(response.body());
    }
    return out.toString();
  }

  private static void appendHeaders(StringBuilder out, Map<String, String> headers) {
    headers.forEach(
        (name, value) -> {
          out.append(name).append(": ");
          out.append("Authorization".equalsIgnoreCase(name) ? "***" : value).append('\n');
        });
  }
}
