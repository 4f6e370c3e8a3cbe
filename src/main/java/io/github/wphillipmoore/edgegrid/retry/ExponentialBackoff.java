package io.github.wphillipmoore.edgegrid.retry;

import io.github.wphillipmoore.edgegrid.TransportResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Doubles the minimum wait on every attempt, capped at the maximum. A {@code Retry-After} header
 * on a 429 or 503 response takes precedence.
 */
public final class ExponentialBackoff implements Backoff {

  private final Clock clock;

  /** Creates a backoff using the system clock for {@code Retry-After} dates. */
  public ExponentialBackoff() {
    this(Clock.systemUTC());
  }

  ExponentialBackoff(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Duration delay(
      Duration minWait, Duration maxWait, int attempt, @Nullable TransportResponse response) {
    if (response != null && (response.statusCode() == 429 || response.statusCode() == 503)) {
      Duration retryAfter = retryAfter(response.header("Retry-After"));
      if (retryAfter != null) {
        return retryAfter;
      }
    }
    double wait = Math.pow(2, attempt) * minWait.toNanos();
    if (Double.isInfinite(wait) || wait > maxWait.toNanos()) {
      return maxWait;
    }
    return Duration.ofNanos((long) wait);
  }

  @Nullable Duration retryAfter(@Nullable String header) {
    if (header == null || header.isBlank()) {
      return null;
    }
    String value = header.trim();
    try {
      long seconds = Long.parseLong(value);
      return seconds < 0 ? null : Duration.ofSeconds(seconds);
    } catch (NumberFormatException e) {
      return retryAfterDate(value);
    }
  }

  private @Nullable Duration retryAfterDate(String value) {
    try {
      ZonedDateTime at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
      Duration wait = Duration.between(clock.instant(), at.toInstant());
      return wait.isNegative() ? Duration.ZERO : wait;
    } catch (DateTimeParseException e) {
      return null;
    }
  }
}
