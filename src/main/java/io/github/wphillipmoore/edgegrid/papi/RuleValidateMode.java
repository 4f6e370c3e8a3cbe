package io.github.wphillipmoore.edgegrid.papi;

import java.util.Set;

/** Values of the {@code validateMode} query parameter. */
public final class RuleValidateMode {

  /** Fast validation. */
  public static final String FAST = "fast";

  /** Full validation. */
  public static final String FULL = "full";

  static final Set<String> ALL = Set.of(FAST, FULL);

  private RuleValidateMode() {}
}
