package io.github.wphillipmoore.edgegrid.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Thrown when a request fails pre-flight struct validation. No request is sent.
 *
 * <p>{@link #getViolations()} maps every invalid field path (for example {@code
 * Rules.Variables[1].Value}) to its message. All violations of a request are reported together.
 */
public final class ValidationException extends EdgeGridException {

  private static final long serialVersionUID = 1L;

  /** Marker included in every validation message. */
  public static final String STRUCT_VALIDATION = "struct validation";

  private final String operation;
  private final Map<String, String> violations;

  /**
   * Creates a validation exception.
   *
   * @param operation short name of the operation whose request was rejected
   * @param violations field path to message, in reporting order (defensively copied)
   */
  public ValidationException(String operation, Map<String, String> violations) {
    super(buildMessage(operation, violations));
    this.operation = operation;
    this.violations = Collections.unmodifiableMap(new LinkedHashMap<>(violations));
  }

  private static String buildMessage(String operation, Map<String, String> violations) {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(violations, "violations");
    String details =
        violations.entrySet().stream()
            .map(entry -> entry.getKey() + ": " + entry.getValue())
            .collect(Collectors.joining("; "));
    return operation + ": " + STRUCT_VALIDATION + ": " + details;
  }

  /** Returns the operation whose request was rejected. */
  public String getOperation() {
    return operation;
  }

  /**
   * Returns the violations keyed by field path. The returned map is unmodifiable.
   *
   * @return an unmodifiable map of field path to message
   */
  public Map<String, String> getViolations() {
    return violations;
  }
}
