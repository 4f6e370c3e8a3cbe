package io.github.wphillipmoore.edgegrid.siteshield;

import com.google.gson.annotations.SerializedName;
import io.github.wphillipmoore.edgegrid.validation.Validatable;
import io.github.wphillipmoore.edgegrid.validation.Violations;

/**
 * Identifies one Site Shield map.
 *
 * @param uniqueId the map ID
 */
public record SiteShieldMapRequest(@SerializedName("UniqueID") int uniqueId)
    implements Validatable {

  @Override
  public void validate(Violations violations) {
    violations.required("UniqueID", uniqueId);
  }
}
