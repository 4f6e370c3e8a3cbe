package io.github.wphillipmoore.edgegrid.papi;

import io.github.wphillipmoore.edgegrid.validation.Validatable;
import io.github.wphillipmoore.edgegrid.validation.Violations;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A property variable declared on a rule.
 *
 * <p>{@code description} and {@code value} are always written, as JSON {@code null} when unset,
 * so an empty string and {@code null} stay distinct on the wire. A variable must carry a value,
 * though it may be empty.
 *
 * @param description the description, or {@code null}
 * @param hidden whether the value is hidden in the UI
 * @param name the variable name, e.g. {@code PMUSER_ORIGIN}
 * @param sensitive whether the value is sensitive
 * @param value the value, or {@code null}
 */
public record RuleVariable(
    @Nullable String description,
    boolean hidden,
    String name,
    boolean sensitive,
    @Nullable String value) implements Validatable {

  /** Replaces a null name with an empty string. */
  public RuleVariable {
    name = Objects.requireNonNullElse(name, "");
  }

  /** Creates a visible, non-sensitive variable without description. */
  public static RuleVariable of(String name, @Nullable String value) {
    return new RuleVariable(null, false, name, false, value);
  }

  @Override
  public void validate(Violations violations) {
    violations.required("Name", name).notNull("Value", value);
  }
}
