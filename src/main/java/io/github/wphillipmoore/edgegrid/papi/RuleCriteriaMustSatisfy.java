package io.github.wphillipmoore.edgegrid.papi;

import com.google.gson.annotations.SerializedName;

/** How a rule's criteria combine. */
public enum RuleCriteriaMustSatisfy {
  /** Every criterion must match. */
  @SerializedName("all")
  ALL,

  /** At least one criterion must match. */
  @SerializedName("any")
  ANY
}
