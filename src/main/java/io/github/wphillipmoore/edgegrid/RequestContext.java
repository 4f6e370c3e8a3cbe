package io.github.wphillipmoore.edgegrid;

import io.github.wphillipmoore.edgegrid.exception.RequestCancelledException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;

/**
 * Per-call options threaded through one logical API call: cancellation, an optional deadline,
 * header overrides and a logger override.
 *
 * <p>Header overrides only fill in headers the request did not set explicitly. Once the context is
 * cancelled or its deadline passes, both the in-flight HTTP wait and any retry sleep end with a
 * {@link RequestCancelledException}.
 *
 * <pre>{@code
 * RequestContext context = RequestContext.builder()
 *     .timeout(Duration.ofSeconds(20))
 *     .header("X-Request-Id", requestId)
 *     .build();
 * papi.getRuleTree(context, request);
 * }</pre>
 */
public final class RequestContext {

  private static final RequestContext BACKGROUND = new RequestContext(new Builder(), false);

  private final Map<String, String> headers;
  private final @Nullable Logger logger;
  private final @Nullable Instant deadline;
  private final boolean cancellable;

  /** Completed with {@code true} when the deadline passed, {@code false} when cancelled. */
  private final CompletableFuture<Boolean> done = new CompletableFuture<>();

  private RequestContext(Builder builder, boolean cancellable) {
    Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    copy.putAll(builder.headers);
    this.headers = Collections.unmodifiableMap(copy);
    this.logger = builder.logger;
    this.deadline = builder.deadline;
    this.cancellable = cancellable;
    if (deadline != null) {
      long delayNanos = Duration.between(Instant.now(), deadline).toNanos();
      if (delayNanos <= 0) {
        done.complete(Boolean.TRUE);
      } else {
        CompletableFuture.delayedExecutor(delayNanos, TimeUnit.NANOSECONDS)
            .execute(() -> done.complete(Boolean.TRUE));
      }
    }
  }

  /** Returns the shared context that is never cancelled and carries no overrides. */
  public static RequestContext background() {
    return BACKGROUND;
  }

  /** Returns a new builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns the header overrides (case-insensitive, unmodifiable). */
  public Map<String, String> getHeaders() {
    return headers;
  }

  /** Returns the logger override, or {@code null} to use the session logger. */
  public @Nullable Logger getLogger() {
    return logger;
  }

  /** Returns the deadline, or {@code null} if none. */
  public @Nullable Instant getDeadline() {
    return deadline;
  }

  /**
   * Cancels the context. Calls in flight stop waiting and throw {@link RequestCancelledException}.
   *
   * @throws UnsupportedOperationException on the {@linkplain #background() background} context
   */
  public void cancel() {
    if (!cancellable) {
      throw new UnsupportedOperationException("the background context cannot be cancelled");
    }
    done.complete(Boolean.FALSE);
  }

  /** Returns {@code true} once the context was cancelled or its deadline passed. */
  public boolean isDone() {
    return done.isDone();
  }

  /** Returns the cancellation error, or {@code null} while the context is live. */
  public @Nullable RequestCancelledException error() {
    Boolean deadlineExceeded = done.getNow(null);
    return deadlineExceeded == null ? null : new RequestCancelledException(deadlineExceeded);
  }

  /**
   * Throws if the context is done.
   *
   * @throws RequestCancelledException if cancelled or expired
   */
  public void throwIfDone() {
    RequestCancelledException error = error();
    if (error != null) {
      throw error;
    }
  }

  /**
   * Sleeps for {@code duration}, waking early if the context ends.
   *
   * @param duration how long to sleep
   * @throws RequestCancelledException if the context ends before or during the sleep
   * @throws InterruptedException if the calling thread is interrupted
   */
  public void sleep(Duration duration) throws InterruptedException {
    throwIfDone();
    if (duration.isNegative() || duration.isZero()) {
      return;
    }
    try {
      done.get(duration.toNanos(), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      return;
    } catch (ExecutionException e) {
      throw new IllegalStateException("context completion failed", e);
    }
    throwIfDone();
  }

  /**
   * Waits for {@code future} unless the context ends first, in which case the future is cancelled.
   *
   * @param future the pending operation
   * @param <T> the result type
   * @return the future's result
   * @throws RequestCancelledException if the context ends first
   * @throws ExecutionException if the future completed exceptionally
   * @throws InterruptedException if the calling thread is interrupted
   */
  public <T> T await(CompletableFuture<T> future)
      throws ExecutionException, InterruptedException {
    CompletableFuture.anyOf(future.handle((result, failure) -> null), done).get();
    if (!future.isDone()) {
      future.cancel(true);
      throwIfDone();
    }
    return future.get();
  }

  /** Builder for {@link RequestContext}. */
  public static final class Builder {

    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private @Nullable Logger logger;
    private @Nullable Instant deadline;

    private Builder() {}

    /** Adds a header override applied when the request does not set the header itself. */
    public Builder header(String name, String value) {
      headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
      return this;
    }

    /** Adds several header overrides. */
    public Builder headers(Map<String, String> values) {
      Objects.requireNonNull(values, "values").forEach(this::header);
      return this;
    }

    /** Sets the logger used for this call instead of the session logger. */
    public Builder logger(Logger logger) {
      this.logger = Objects.requireNonNull(logger, "logger");
      return this;
    }

    /** Sets an absolute deadline. */
    public Builder deadline(Instant deadline) {
      this.deadline = Objects.requireNonNull(deadline, "deadline");
      return this;
    }

    /** Sets the deadline relative to now. */
    public Builder timeout(Duration timeout) {
      return deadline(Instant.now().plus(Objects.requireNonNull(timeout, "timeout")));
    }

    /** Builds the context; a deadline starts counting immediately. */
    public RequestContext build() {
      return new RequestContext(this, true);
    }
  }
}
