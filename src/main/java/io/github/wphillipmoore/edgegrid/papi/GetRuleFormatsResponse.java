package io.github.wphillipmoore.edgegrid.papi;

import java.util.List;

/**
 * Available rule formats.
 *
 * @param ruleFormats the formats, newest last
 */
public record GetRuleFormatsResponse(RuleFormatItems ruleFormats) {

  /**
   * Wrapper of the rule format list.
   *
   * @param items format identifiers such as {@code v2023-01-05} and {@code latest}
   */
  public record RuleFormatItems(List<String> items) {}
}
