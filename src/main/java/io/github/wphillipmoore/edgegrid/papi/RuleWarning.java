package io.github.wphillipmoore.edgegrid.papi;

/**
 * A warning reported for a saved rule tree.
 *
 * @param title short summary
 * @param type the warning type URI
 * @param errorLocation JSON pointer into the rule tree
 * @param detail full description
 * @param currentRuleFormat the tree's rule format
 * @param suggestedRuleFormat a suggested newer rule format
 */
public record RuleWarning(
    String title,
    String type,
    String errorLocation,
    String detail,
    String currentRuleFormat,
    String suggestedRuleFormat) {}
