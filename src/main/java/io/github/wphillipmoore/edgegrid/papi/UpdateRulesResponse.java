package io.github.wphillipmoore.edgegrid.papi;

import io.github.wphillipmoore.edgegrid.json.OmitEmpty;
import java.util.List;

/**
 * The saved rule tree, with any validation errors and warnings.
 *
 * @param accountId the account ID
 * @param contractId the contract ID
 * @param comments version comments
 * @param groupId the group ID
 * @param propertyId the property ID
 * @param propertyVersion the property version
 * @param etag the entity tag of the tree
 * @param ruleFormat the rule format of the tree
 * @param rules the root rule
 * @param errors validation errors, may be {@code null}
 * @param warnings validation warnings, may be {@code null}
 */
public record UpdateRulesResponse(
    String accountId,
    String contractId,
    @OmitEmpty String comments,
    String groupId,
    String propertyId,
    int propertyVersion,
    String etag,
    String ruleFormat,
    Rules rules,
    List<RuleError> errors,
    List<RuleWarning> warnings) {}
