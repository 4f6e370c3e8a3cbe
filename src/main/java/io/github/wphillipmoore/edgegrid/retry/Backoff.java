package io.github.wphillipmoore.edgegrid.retry;

import io.github.wphillipmoore.edgegrid.TransportResponse;
import java.time.Duration;
import org.jspecify.annotations.Nullable;

/** Computes how long to wait before the next attempt. */
@FunctionalInterface
public interface Backoff {

  /**
   * Returns the wait before the next attempt.
   *
   * @param minWait the configured minimum wait
   * @param maxWait the configured maximum wait
   * @param attempt the zero-based number of the attempt that just failed
   * @param response the last response, or {@code null} after a transport failure
   * @return the wait, never negative
   */
  Duration delay(
      Duration minWait, Duration maxWait, int attempt, @Nullable TransportResponse response);
}
