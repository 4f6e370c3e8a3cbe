package io.github.wphillipmoore.edgegrid.retry;

import io.github.wphillipmoore.edgegrid.exception.ConfigurationException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Configuration for automatic retries of idempotent requests.
 *
 * <p>Validated eagerly: construction fails with one {@link ConfigurationException} listing every
 * problem, so an invalid configuration is never partially applied.
 *
 * @param maxRetries the maximum number of retries after the first attempt (must be &gt;= 0)
 * @param minWait the minimum wait between attempts (must be &gt;= 0)
 * @param maxWait the maximum wait between attempts (must be &gt;= minWait)
 * @param excludedEndpoints path patterns that are never retried, see {@link PathPattern}
 */
public record RetryConfig(
    int maxRetries, Duration minWait, Duration maxWait, List<String> excludedEndpoints) {

  /** Default maximum number of retries (10). */
  public static final int DEFAULT_MAX_RETRIES = 10;

  /** Default minimum wait (1 second). */
  public static final Duration DEFAULT_MIN_WAIT = Duration.ofSeconds(1);

  /** Default maximum wait (30 seconds). */
  public static final Duration DEFAULT_MAX_WAIT = Duration.ofSeconds(30);

  /**
   * Creates a retry configuration.
   *
   * @throws ConfigurationException listing every invalid setting
   */
  public RetryConfig {
    Objects.requireNonNull(minWait, "minWait");
    Objects.requireNonNull(maxWait, "maxWait");
    excludedEndpoints = List.copyOf(Objects.requireNonNull(excludedEndpoints, "excludedEndpoints"));

    List<String> problems = new ArrayList<>();
    if (maxRetries < 0) {
      problems.add("maximum number of retries cannot be negative");
    }
    if (minWait.isNegative()) {
      problems.add("minimum retry wait time cannot be negative");
    }
    if (maxWait.isNegative()) {
      problems.add("maximum retry wait time cannot be negative");
    }
    if (maxWait.compareTo(minWait) < 0) {
      problems.add("maximum retry wait time cannot be shorter than minimum retry wait time");
    }
    for (String pattern : excludedEndpoints) {
      try {
        PathPattern.compile(pattern);
      } catch (IllegalArgumentException e) {
        problems.add("malformed exclude endpoint pattern: " + e.getMessage() + ": " + pattern);
      }
    }
    if (!problems.isEmpty()) {
      throw new ConfigurationException("retry configuration failed", problems);
    }
  }

  /** Creates a retry configuration with default values (10 retries, 1s to 30s, no exclusions). */
  public RetryConfig() {
    this(DEFAULT_MAX_RETRIES, DEFAULT_MIN_WAIT, DEFAULT_MAX_WAIT, List.of());
  }

  /** Returns a copy with the given excluded endpoint patterns. */
  public RetryConfig withExcludedEndpoints(List<String> patterns) {
    return new RetryConfig(maxRetries, minWait, maxWait, patterns);
  }

  List<PathPattern> compiledExclusions() {
    List<PathPattern> compiled = new ArrayList<>(excludedEndpoints.size());
    for (String pattern : excludedEndpoints) {
      compiled.add(PathPattern.compile(pattern));
    }
    return compiled;
  }
}
