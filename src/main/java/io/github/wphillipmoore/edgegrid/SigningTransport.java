package io.github.wphillipmoore.edgegrid;

import io.github.wphillipmoore.edgegrid.auth.Signer;
import io.github.wphillipmoore.edgegrid.exception.TransportException;
import java.net.ProtocolException;
import java.net.URI;
import java.util.Objects;
import java.util.Set;

/**
 * Signs each request immediately before it is sent and follows redirects, signing every hop
 * again.
 *
 * <p>301, 302 and 303 turn a request other than {@code GET} or {@code HEAD} into a body-less
 * {@code GET}; 307 and 308 repeat the method and body.
 */
final class SigningTransport implements EdgeGridTransport {

  static final int MAX_REDIRECTS = 10;

  private static final Set<Integer> REDIRECTS = Set.of(301, 302, 303, 307, 308);
  private static final Set<Integer> SWITCH_TO_GET = Set.of(301, 302, 303);

  private final EdgeGridTransport delegate;
  private final Signer signer;

  SigningTransport(EdgeGridTransport delegate, Signer signer) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.signer = Objects.requireNonNull(signer, "signer");
  }

  @Override
  public TransportResponse send(TransportRequest request, RequestContext context) {
    TransportRequest hop = request;
    for (int redirects = 0; ; redirects++) {
      TransportRequest signed = hop.copy();
      signer.sign(signed);
      TransportResponse response = delegate.send(signed, context);

      String location = response.header("Location");
      if (!REDIRECTS.contains(response.statusCode()) || location == null || location.isEmpty()) {
        return response;
      }
      String url = hop.getUri().toString();
      if (redirects >= MAX_REDIRECTS) {
        String message = "stopped after " + MAX_REDIRECTS + " redirects";
        throw new TransportException(
            message, request.getMethod(), url, new ProtocolException(message));
      }
      context.throwIfDone();

      URI target;
      try {
        target = hop.getUri().resolve(location);
      } catch (IllegalArgumentException e) {
        throw new TransportException(
            "invalid redirect location: " + location, hop.getMethod(), url, e);
      }
      boolean switchToGet =
          SWITCH_TO_GET.contains(response.statusCode())
              && !"GET".equals(hop.getMethod())
              && !"HEAD".equals(hop.getMethod());
      hop = hop.redirectTo(target, switchToGet);
    }
  }
}
