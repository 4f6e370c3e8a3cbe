package io.github.wphillipmoore.edgegrid.retry;

import io.github.wphillipmoore.edgegrid.EdgeGridTransport;
import io.github.wphillipmoore.edgegrid.RequestContext;
import io.github.wphillipmoore.edgegrid.TransportRequest;
import io.github.wphillipmoore.edgegrid.TransportResponse;
import io.github.wphillipmoore.edgegrid.exception.TransportException;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;

/**
 * Transport decorator that repeats attempts the {@link RetryPolicy} classifies as retryable.
 *
 * <p>At most {@link RetryConfig#maxRetries()} retries follow the first attempt. When retries are
 * exhausted, or the policy declines, the last response is returned or the last transport failure
 * rethrown as is. Cancellation of the context is always terminal.
 */
public final class RetryingTransport implements EdgeGridTransport {

  private final EdgeGridTransport delegate;
  private final RetryConfig config;
  private final RetryPolicy policy;
  private final Backoff backoff;
  private final Sleeper sleeper;
  private final Function<RequestContext, Logger> loggers;

  /**
   * Creates a retrying transport.
   *
   * @param delegate the transport performing each attempt
   * @param config retry limits
   * @param policy retry classification
   * @param backoff wait computation
   * @param sleeper wait implementation
   * @param loggers resolves the logger for a call
   */
  public RetryingTransport(
      EdgeGridTransport delegate,
      RetryConfig config,
      RetryPolicy policy,
      Backoff backoff,
      Sleeper sleeper,
      Function<RequestContext, Logger> loggers) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.config = Objects.requireNonNull(config, "config");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.backoff = Objects.requireNonNull(backoff, "backoff");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.loggers = Objects.requireNonNull(loggers, "loggers");
  }

  /**
   * Creates the standard retry stack for a configuration: {@link EndpointRetryPolicy} over {@link
   * StandardRetryPolicy}, and {@link RateLimitBackoff} over {@link ExponentialBackoff}.
   */
  public static RetryingTransport standard(
      EdgeGridTransport delegate,
      RetryConfig config,
      Sleeper sleeper,
      Logger logger,
      Function<RequestContext, Logger> loggers) {
    return new RetryingTransport(
        delegate,
        config,
        new EndpointRetryPolicy(new StandardRetryPolicy(), config.compiledExclusions()),
        new RateLimitBackoff(new ExponentialBackoff(), logger),
        sleeper,
        loggers);
  }

  @Override
  public TransportResponse send(TransportRequest request, RequestContext context) {
    for (int attempt = 0; ; attempt++) {
      TransportResponse response = null;
      TransportException failure = null;
      try {
        response = delegate.send(request, context);
      } catch (TransportException e) {
        failure = e;
      }

      boolean retry = policy.shouldRetry(context, request, response, failure);
      if (!retry || attempt >= config.maxRetries()) {
        return finish(response, failure);
      }

      Duration wait = backoff.delay(config.minWait(), config.maxWait(), attempt, response);
      Logger logger = loggers.apply(context);
      if (logger.isDebugEnabled()) {
        logger.debug(
            "{} {}: retrying in {} ({} left)",
            request,
            response != null ? "status " + response.statusCode() : "failed",
            wait,
            config.maxRetries() - attempt);
      }
      try {
        sleeper.sleep(wait, context);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new TransportException(
            "retry wait interrupted", request.getMethod(), request.getUri().toString(), e);
      }
    }
  }

  private static TransportResponse finish(
      @Nullable TransportResponse response, @Nullable TransportException failure) {
    if (failure != null) {
      throw failure;
    }
    return Objects.requireNonNull(response, "response");
  }
}
