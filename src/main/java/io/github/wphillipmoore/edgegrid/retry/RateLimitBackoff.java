package io.github.wphillipmoore.edgegrid.retry;

import io.github.wphillipmoore.edgegrid.TransportResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;

/**
 * Backoff that waits until the server's announced {@code X-RateLimit-Next} instant on 429
 * responses, falling back to a base backoff otherwise.
 *
 * <p>{@code Date} has second resolution while {@code X-RateLimit-Next} has millisecond resolution,
 * so the computed wait may exceed the real cooldown by up to one second. It is never shorter.
 */
public final class RateLimitBackoff implements Backoff {

  static final String RATE_LIMIT_NEXT = "X-RateLimit-Next";
  static final String DATE = "Date";

  private final Backoff base;
  private final Logger logger;

  /**
   * Creates the backoff.
   *
   * @param base the backoff used when no usable rate-limit headers are present
   * @param logger where header problems are reported
   */
  public RateLimitBackoff(Backoff base, Logger logger) {
    this.base = Objects.requireNonNull(base, "base");
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  @Override
  public Duration delay(
      Duration minWait, Duration maxWait, int attempt, @Nullable TransportResponse response) {
    if (response != null && response.statusCode() == 429) {
      Duration wait = rateLimitWait(response);
      if (wait != null) {
        return wait;
      }
    }
    return base.delay(minWait, maxWait, attempt, response);
  }

  @Nullable Duration rateLimitWait(TransportResponse response) {
    String nextHeader = response.header(RATE_LIMIT_NEXT);
    if (nextHeader == null || nextHeader.isEmpty()) {
      return null;
    }
    Instant next;
    try {
      next = OffsetDateTime.parse(nextHeader, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
    } catch (DateTimeParseException e) {
      logger.error("Could not parse {} header: {}", RATE_LIMIT_NEXT, nextHeader, e);
      return null;
    }

    String dateHeader = response.header(DATE);
    if (dateHeader == null || dateHeader.isEmpty()) {
      logger.warn("No Date header for {}: {}", RATE_LIMIT_NEXT, nextHeader);
      return null;
    }
    Instant date;
    try {
      date = ZonedDateTime.parse(dateHeader, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
    } catch (DateTimeParseException e) {
      logger.error("Could not parse Date header: {}", dateHeader, e);
      return null;
    }

    if (next.isBefore(date)) {
      logger.warn("{}: {} before Date: {}", RATE_LIMIT_NEXT, nextHeader, dateHeader);
      return null;
    }
    return Duration.between(date, next);
  }
}
