package io.github.wphillipmoore.edgegrid.papi;

import io.github.wphillipmoore.edgegrid.validation.Validatable;
import io.github.wphillipmoore.edgegrid.validation.Violations;
import java.util.Objects;

/**
 * Parameters of {@link PapiClient#updateRuleTree}.
 *
 * <p>Violations inside the tree are reported under {@code Rules}, e.g. {@code
 * Rules.Children[0].Variables[1].Value}.
 *
 * @param propertyId the property ID
 * @param propertyVersion the property version
 * @param contractId the contract ID
 * @param groupId the group ID
 * @param dryRun validate without saving
 * @param validateMode {@link RuleValidateMode#FAST}, {@link RuleValidateMode#FULL} or empty
 * @param validateRules whether the server should validate the tree
 * @param rules the request body
 */
public record UpdateRulesRequest(
    String propertyId,
    int propertyVersion,
    String contractId,
    String groupId,
    boolean dryRun,
    String validateMode,
    boolean validateRules,
    RulesUpdate rules)
    implements Validatable {

  /** Replaces null strings with empty ones. */
  public UpdateRulesRequest {
    propertyId = Objects.requireNonNullElse(propertyId, "");
    contractId = Objects.requireNonNullElse(contractId, "");
    groupId = Objects.requireNonNullElse(groupId, "");
    validateMode = Objects.requireNonNullElse(validateMode, "");
    Objects.requireNonNull(rules, "rules");
  }

  /** Creates a request that saves the tree with rule validation off. */
  public UpdateRulesRequest(
      String propertyId,
      int propertyVersion,
      String contractId,
      String groupId,
      RulesUpdate rules) {
    this(propertyId, propertyVersion, contractId, groupId, false, "", false, rules);
  }

  /** Returns a copy with dry run switched on or off. */
  public UpdateRulesRequest withDryRun(boolean enabled) {
    return new UpdateRulesRequest(
        propertyId,
        propertyVersion,
        contractId,
        groupId,
        enabled,
        validateMode,
        validateRules,
        rules);
  }

  /** Returns a copy with the given validation mode. */
  public UpdateRulesRequest withValidateMode(String mode) {
    return new UpdateRulesRequest(
        propertyId, propertyVersion, contractId, groupId, dryRun, mode, validateRules, rules);
  }

  /** Returns a copy with rule validation switched on or off. */
  public UpdateRulesRequest withValidateRules(boolean validate) {
    return new UpdateRulesRequest(
        propertyId, propertyVersion, contractId, groupId, dryRun, validateMode, validate, rules);
  }

  @Override
  public void validate(Violations violations) {
    violations
        .required("PropertyID", propertyId)
        .required("PropertyVersion", propertyVersion)
        .oneOf("ValidateMode", validateMode, RuleValidateMode.ALL)
        .nested("Rules", rules.rules());
  }
}
