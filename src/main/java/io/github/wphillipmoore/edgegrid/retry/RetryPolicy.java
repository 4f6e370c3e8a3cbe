package io.github.wphillipmoore.edgegrid.retry;

import io.github.wphillipmoore.edgegrid.RequestContext;
import io.github.wphillipmoore.edgegrid.TransportRequest;
import io.github.wphillipmoore.edgegrid.TransportResponse;
import io.github.wphillipmoore.edgegrid.exception.TransportException;
import org.jspecify.annotations.Nullable;

/** Decides whether a completed attempt should be retried. */
@FunctionalInterface
public interface RetryPolicy {

  /**
   * Classifies one attempt. Exactly one of {@code response} and {@code failure} is non-null.
   *
   * @param context the call context
   * @param request the request that was sent
   * @param response the response, or {@code null} if the transport failed
   * @param failure the transport failure, or {@code null} if a response arrived
   * @return {@code true} to retry
   * @throws io.github.wphillipmoore.edgegrid.exception.RequestCancelledException if the context
   *     has ended; this is terminal
   */
  boolean shouldRetry(
      RequestContext context,
      TransportRequest request,
      @Nullable TransportResponse response,
      @Nullable TransportException failure);
}
