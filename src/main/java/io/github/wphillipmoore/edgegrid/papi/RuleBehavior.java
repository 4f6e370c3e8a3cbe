package io.github.wphillipmoore.edgegrid.papi;

import com.google.gson.JsonObject;
import io.github.wphillipmoore.edgegrid.json.OmitEmpty;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A behavior or a criterion of a rule.
 *
 * <p>{@code options} is free-form: its schema is defined per behavior by the rule format, so it is
 * kept as an ordered JSON object and always written, as {@code {}} when empty.
 *
 * @param locked whether the behavior is locked
 * @param name the behavior name, e.g. {@code origin}
 * @param options the behavior options
 * @param uuid the behavior UUID, if any
 * @param templateUuid the UUID of the template it came from, if any
 */
public record RuleBehavior(
    @OmitEmpty boolean locked,
    String name,
    JsonObject options,
    @OmitEmpty String uuid,
    @OmitEmpty String templateUuid) {

  /** Replaces null fields with empty values and copies {@code options}. */
  public RuleBehavior {
    name = Objects.requireNonNullElse(name, "");
    options = options == null ? new JsonObject() : options.deepCopy();
    uuid = Objects.requireNonNullElse(uuid, "");
    templateUuid = Objects.requireNonNullElse(templateUuid, "");
  }

  /** Creates an unlocked behavior with the given options. */
  public static RuleBehavior of(String name, @Nullable JsonObject options) {
    return new RuleBehavior(false, name, options, "", "");
  }

  /** Returns a copy of the options. */
  @Override
  public JsonObject options() {
    return options.deepCopy();
  }
}
