package io.github.wphillipmoore.edgegrid.papi;

import io.github.wphillipmoore.edgegrid.json.OmitEmpty;

/**
 * A property version's rule tree.
 *
 * @param accountId the account ID
 * @param contractId the contract ID
 * @param groupId the group ID
 * @param propertyId the property ID
 * @param propertyVersion the property version
 * @param etag the entity tag of the tree
 * @param ruleFormat the rule format of the tree
 * @param rules the root rule
 * @param comments version comments
 */
public record GetRuleTreeResponse(
    String accountId,
    String contractId,
    String groupId,
    String propertyId,
    int propertyVersion,
    String etag,
    String ruleFormat,
    Rules rules,
    @OmitEmpty String comments) {}
