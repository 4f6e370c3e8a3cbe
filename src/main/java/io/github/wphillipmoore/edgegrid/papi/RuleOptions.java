package io.github.wphillipmoore.edgegrid.papi;

import com.google.gson.annotations.SerializedName;
import io.github.wphillipmoore.edgegrid.json.OmitEmpty;

/**
 * Options of a rule.
 *
 * @param secure whether the rule applies to secure traffic
 */
public record RuleOptions(@SerializedName("is_secure") @OmitEmpty boolean secure) {

  /** Options with every flag unset. */
  public static final RuleOptions NONE = new RuleOptions(false);
}
