package io.github.wphillipmoore.edgegrid.validation;

import io.github.wphillipmoore.edgegrid.exception.ValidationException;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Collects struct validation failures keyed by field path.
 *
 * <p>Rules never short-circuit: every check records its own violation, and nested values are
 * validated through {@link #nested} and {@link #each}, which report under {@code Parent.Child} and
 * {@code Parent[i]} paths. Scoped collectors share the same underlying map, so one aggregate covers
 * the whole structure.
 *
 * <pre>{@code
 * Violations violations = new Violations();
 * violations
 *     .required("PropertyID", propertyId)
 *     .oneOf("ValidateMode", validateMode, Set.of("fast", "full"))
 *     .nested("Rules", rules);
 * violations.throwIfAny("updating rule tree");
 * }</pre>
 */
public final class Violations {

  static final String BLANK = "cannot be blank";
  static final String INVALID_VALUE = "must be a valid value";
  static final String INVALID_FORMAT = "must be in a valid format";
  static final String REQUIRED = "is required";

  private final Map<String, String> entries;
  private final String prefix;

  /** Creates an empty root collector. */
  public Violations() {
    this(new TreeMap<>(), "");
  }

  private Violations(Map<String, String> entries, String prefix) {
    this.entries = entries;
    this.prefix = prefix;
  }

  /** Requires a non-empty string. */
  public Violations required(String field, @Nullable String value) {
    if (value == null || value.isEmpty()) {
      add(field, BLANK);
    }
    return this;
  }

  /** Requires a non-zero number. */
  public Violations required(String field, long value) {
    if (value == 0) {
      add(field, BLANK);
    }
    return this;
  }

  /** Requires a non-empty collection. */
  public Violations required(String field, @Nullable Collection<?> value) {
    if (value == null || value.isEmpty()) {
      add(field, BLANK);
    }
    return this;
  }

  /** Requires a non-empty value to be one of {@code allowed}. Empty values pass. */
  public Violations oneOf(String field, @Nullable String value, Collection<String> allowed) {
    if (value != null && !value.isEmpty() && !allowed.contains(value)) {
      add(field, INVALID_VALUE);
    }
    return this;
  }

  /** Requires a non-empty value to match {@code pattern} in full. Empty values pass. */
  public Violations matches(String field, @Nullable String value, Pattern pattern) {
    if (value != null && !value.isEmpty() && !pattern.matcher(value).matches()) {
      add(field, INVALID_FORMAT);
    }
    return this;
  }

  /** Requires a present value; an empty string is accepted. */
  public Violations notNull(String field, @Nullable Object value) {
    if (value == null) {
      add(field, REQUIRED);
    }
    return this;
  }

  /** Validates a nested value under {@code field}. A null value is skipped. */
  public Violations nested(String field, @Nullable Validatable value) {
    if (value != null) {
      value.validate(scope(field));
    }
    return this;
  }

  /** Validates each element under {@code field[i]}. A null list and null elements are skipped. */
  public Violations each(String field, @Nullable List<? extends Validatable> values) {
    if (values == null) {
      return this;
    }
    for (int i = 0; i < values.size(); i++) {
      Validatable value = values.get(i);
      if (value != null) {
        value.validate(scope(field + "[" + i + "]"));
      }
    }
    return this;
  }

  /** Records a custom violation for {@code field}. */
  public Violations add(String field, String message) {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(message, "message");
    entries.putIfAbsent(prefix + field, message);
    return this;
  }

  /** Returns {@code true} when no violation was recorded. */
  public boolean isEmpty() {
    return entries.isEmpty();
  }

  /** Returns the recorded violations sorted by field path. The map is unmodifiable. */
  public Map<String, String> asMap() {
    return Collections.unmodifiableMap(entries);
  }

  /**
   * Throws when any violation was recorded.
   *
   * @param operation short name of the operation, used as the message prefix
   * @throws ValidationException listing every violation
   */
  public void throwIfAny(String operation) {
    if (!entries.isEmpty()) {
      throw new ValidationException(operation, entries);
    }
  }

  private Violations scope(String field) {
    return new Violations(entries, prefix + field + ".");
  }
}
