package io.github.wphillipmoore.edgegrid.papi;

import io.github.wphillipmoore.edgegrid.validation.Validatable;
import io.github.wphillipmoore.edgegrid.validation.Violations;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Parameters of {@link PapiClient#getRuleTree}.
 *
 * @param propertyId the property ID
 * @param propertyVersion the property version
 * @param contractId the contract ID
 * @param groupId the group ID
 * @param validateMode {@link RuleValidateMode#FAST}, {@link RuleValidateMode#FULL} or empty
 * @param validateRules whether the server should validate the returned tree
 * @param ruleFormat the rule format to return, {@code latest} or {@code vYYYY-MM-DD}, or empty
 */
public record GetRuleTreeRequest(
    String propertyId,
    int propertyVersion,
    String contractId,
    String groupId,
    String validateMode,
    boolean validateRules,
    String ruleFormat)
    implements Validatable {

  static final Pattern RULE_FORMAT = Pattern.compile("^(latest|v\\d{4}-\\d{2}-\\d{2})$");

  /** Replaces null strings with empty ones. */
  public GetRuleTreeRequest {
    propertyId = Objects.requireNonNullElse(propertyId, "");
    contractId = Objects.requireNonNullElse(contractId, "");
    groupId = Objects.requireNonNullElse(groupId, "");
    validateMode = Objects.requireNonNullElse(validateMode, "");
    ruleFormat = Objects.requireNonNullElse(ruleFormat, "");
  }

  /** Creates a request without validation mode or rule format, with rule validation off. */
  public GetRuleTreeRequest(
      String propertyId, int propertyVersion, String contractId, String groupId) {
    this(propertyId, propertyVersion, contractId, groupId, "", false, "");
  }

  /** Returns a copy with the given validation mode. */
  public GetRuleTreeRequest withValidateMode(String mode) {
    return new GetRuleTreeRequest(
        propertyId, propertyVersion, contractId, groupId, mode, validateRules, ruleFormat);
  }

  /** Returns a copy with rule validation switched on or off. */
  public GetRuleTreeRequest withValidateRules(boolean validate) {
    return new GetRuleTreeRequest(
        propertyId, propertyVersion, contractId, groupId, validateMode, validate, ruleFormat);
  }

  /** Returns a copy with the given rule format. */
  public GetRuleTreeRequest withRuleFormat(String format) {
    return new GetRuleTreeRequest(
        propertyId, propertyVersion, contractId, groupId, validateMode, validateRules, format);
  }

  @Override
  public void validate(Violations violations) {
    violations
        .required("PropertyID", propertyId)
        .required("PropertyVersion", propertyVersion)
        .oneOf("ValidateMode", validateMode, RuleValidateMode.ALL)
        .matches("RuleFormat", ruleFormat, RULE_FORMAT);
  }
}
