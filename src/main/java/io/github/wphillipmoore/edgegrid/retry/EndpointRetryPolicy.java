package io.github.wphillipmoore.edgegrid.retry;

import io.github.wphillipmoore.edgegrid.RequestContext;
import io.github.wphillipmoore.edgegrid.TransportRequest;
import io.github.wphillipmoore.edgegrid.TransportResponse;
import io.github.wphillipmoore.edgegrid.exception.TransportException;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Retry policy that only ever retries {@code GET}, honours excluded endpoints and always retries
 * PAPI rate limiting and write conflicts. Everything else is delegated to a base policy.
 */
public final class EndpointRetryPolicy implements RetryPolicy {

  static final String PAPI_PREFIX = "/papi/";

  private final RetryPolicy base;
  private final List<PathPattern> excluded;

  /**
   * Creates the policy.
   *
   * @param base the policy consulted for cases without a special rule
   * @param excluded paths that are never retried
   */
  public EndpointRetryPolicy(RetryPolicy base, List<PathPattern> excluded) {
    this.base = Objects.requireNonNull(base, "base");
    this.excluded = List.copyOf(Objects.requireNonNull(excluded, "excluded"));
  }

  @Override
  public boolean shouldRetry(
      RequestContext context,
      TransportRequest request,
      @Nullable TransportResponse response,
      @Nullable TransportException failure) {
    context.throwIfDone();

    if (!"GET".equals(request.getMethod())) {
      return false;
    }
    String path = request.getUri().getPath();
    if (isExcluded(path)) {
      return false;
    }
    if (response == null) {
      return base.shouldRetry(context, request, null, failure);
    }
    if (response.statusCode() == 429 && path != null && path.startsWith(PAPI_PREFIX)) {
      return true;
    }
    if (response.statusCode() == 409) {
      return true;
    }
    return base.shouldRetry(context, request, response, failure);
  }

  boolean isExcluded(@Nullable String path) {
    if (path == null) {
      return false;
    }
    for (PathPattern pattern : excluded) {
      if (pattern.matches(path)) {
        return true;
      }
    }
    return false;
  }
}
