package io.github.wphillipmoore.edgegrid;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.wphillipmoore.edgegrid.exception.TransportException;
import java.time.Duration;
import java.util.Objects;

/** Holds each attempt back until the session's per-second request ceiling has room for it. */
final class ThrottlingTransport implements EdgeGridTransport {

  static final Duration POLL_INTERVAL = Duration.ofMillis(20);

  private final EdgeGridTransport delegate;
  private final RateLimiter limiter;

  ThrottlingTransport(EdgeGridTransport delegate, int requestsPerSecond) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.limiter =
        RateLimiter.of(
            "edgegrid-session",
            RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(requestsPerSecond)
                .timeoutDuration(Duration.ZERO)
                .build());
  }

  @Override
  public TransportResponse send(TransportRequest request, RequestContext context) {
    while (!limiter.acquirePermission()) {
      try {
        context.sleep(POLL_INTERVAL);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new TransportException(
            "request throttling interrupted", request.getMethod(), request.getUri().toString(), e);
      }
    }
    return delegate.send(request, context);
  }
}
