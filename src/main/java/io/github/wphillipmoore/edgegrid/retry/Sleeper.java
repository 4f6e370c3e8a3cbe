package io.github.wphillipmoore.edgegrid.retry;

import io.github.wphillipmoore.edgegrid.RequestContext;
import java.time.Duration;

/** Pauses between retry attempts. Replaced in tests to avoid real waiting. */
@FunctionalInterface
public interface Sleeper {

  /** Sleeper that blocks the calling thread until the wait elapses or the context ends. */
  Sleeper SYSTEM = (duration, context) -> context.sleep(duration);

  /**
   * Waits for {@code duration}.
   *
   * @param duration how long to wait
   * @param context the call context; the wait ends early when it does
   * @throws io.github.wphillipmoore.edgegrid.exception.RequestCancelledException if the context
   *     ends first
   * @throws InterruptedException if the calling thread is interrupted
   */
  void sleep(Duration duration, RequestContext context) throws InterruptedException;
}
