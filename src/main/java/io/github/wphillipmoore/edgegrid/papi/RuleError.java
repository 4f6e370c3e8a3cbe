package io.github.wphillipmoore.edgegrid.papi;

/**
 * A validation error reported for a saved rule tree.
 *
 * @param type the error type URI
 * @param title short summary
 * @param detail full description
 * @param instance the error instance
 * @param behaviorName the behavior involved, if any
 * @param errorLocation JSON pointer into the rule tree
 */
public record RuleError(
    String type,
    String title,
    String detail,
    String instance,
    String behaviorName,
    String errorLocation) {}
