package io.github.wphillipmoore.edgegrid.papi;

import io.github.wphillipmoore.edgegrid.json.OmitEmpty;
import java.util.Objects;

/**
 * Body of a rule tree update.
 *
 * @param comments version comments
 * @param rules the new root rule
 */
public record RulesUpdate(@OmitEmpty String comments, Rules rules) {

  /** Replaces null comments with an empty string. */
  public RulesUpdate {
    comments = Objects.requireNonNullElse(comments, "");
    Objects.requireNonNull(rules, "rules");
  }

  /** Creates an update without comments. */
  public RulesUpdate(Rules rules) {
    this("", rules);
  }
}
