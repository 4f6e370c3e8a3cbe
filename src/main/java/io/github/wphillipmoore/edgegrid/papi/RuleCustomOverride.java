package io.github.wphillipmoore.edgegrid.papi;

import io.github.wphillipmoore.edgegrid.validation.Validatable;
import io.github.wphillipmoore.edgegrid.validation.Violations;
import java.util.Objects;

/**
 * Reference to a custom XML override of a rule.
 *
 * @param name the override name
 * @param overrideId the override identifier
 */
public record RuleCustomOverride(String name, String overrideId) implements Validatable {

  /** Replaces null fields with empty strings. */
  public RuleCustomOverride {
    name = Objects.requireNonNullElse(name, "");
    overrideId = Objects.requireNonNullElse(overrideId, "");
  }

  @Override
  public void validate(Violations violations) {
    violations.required("Name", name).required("OverrideID", overrideId);
  }
}
