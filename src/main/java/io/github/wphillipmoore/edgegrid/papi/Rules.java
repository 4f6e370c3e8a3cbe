package io.github.wphillipmoore.edgegrid.papi;

import io.github.wphillipmoore.edgegrid.json.OmitEmpty;
import io.github.wphillipmoore.edgegrid.validation.Validatable;
import io.github.wphillipmoore.edgegrid.validation.Violations;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A rule of a property's rule tree; the tree's root is the {@code default} rule.
 *
 * <p>Members marked {@link OmitEmpty} are left out of the JSON when empty. Absent lists and
 * strings decode as empty, so a tree survives a round trip through the API unchanged.
 *
 * @param advancedOverride advanced XML override, if any
 * @param behaviors the rule's behaviors
 * @param children nested rules
 * @param comments free-form comments
 * @param criteria the rule's match criteria
 * @param criteriaLocked whether the criteria are locked
 * @param customOverride a custom XML override reference, or {@code null}
 * @param name the rule name
 * @param options the rule options
 * @param uuid the rule UUID, if any
 * @param templateUuid the UUID of the template it came from, if any
 * @param templateLink a link to the template, if any
 * @param variables property variables declared on this rule
 * @param criteriaMustSatisfy how criteria combine, or {@code null} for the default
 */
public record Rules(
    @OmitEmpty String advancedOverride,
    @OmitEmpty List<RuleBehavior> behaviors,
    @OmitEmpty List<Rules> children,
    @OmitEmpty String comments,
    @OmitEmpty List<RuleBehavior> criteria,
    @OmitEmpty boolean criteriaLocked,
    @OmitEmpty @Nullable RuleCustomOverride customOverride,
    String name,
    RuleOptions options,
    @OmitEmpty String uuid,
    @OmitEmpty String templateUuid,
    @OmitEmpty String templateLink,
    @OmitEmpty List<RuleVariable> variables,
    @OmitEmpty @Nullable RuleCriteriaMustSatisfy criteriaMustSatisfy)
    implements Validatable {

  /** Replaces null lists and strings with empty ones and copies the lists. */
  public Rules {
    advancedOverride = Objects.requireNonNullElse(advancedOverride, "");
    behaviors = behaviors == null ? List.of() : List.copyOf(behaviors);
    children = children == null ? List.of() : List.copyOf(children);
    comments = Objects.requireNonNullElse(comments, "");
    criteria = criteria == null ? List.of() : List.copyOf(criteria);
    name = Objects.requireNonNullElse(name, "");
    options = Objects.requireNonNullElse(options, RuleOptions.NONE);
    uuid = Objects.requireNonNullElse(uuid, "");
    templateUuid = Objects.requireNonNullElse(templateUuid, "");
    templateLink = Objects.requireNonNullElse(templateLink, "");
    variables = variables == null ? List.of() : List.copyOf(variables);
  }

  /** Returns a new builder for a rule named {@code name}. */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  /** Returns a builder initialised from this rule. */
  public Builder toBuilder() {
    Builder builder = new Builder(name);
    builder.advancedOverride = advancedOverride;
    builder.behaviors.addAll(behaviors);
    builder.children.addAll(children);
    builder.comments = comments;
    builder.criteria.addAll(criteria);
    builder.criteriaLocked = criteriaLocked;
    builder.customOverride = customOverride;
    builder.options = options;
    builder.uuid = uuid;
    builder.templateUuid = templateUuid;
    builder.templateLink = templateLink;
    builder.variables.addAll(variables);
    builder.criteriaMustSatisfy = criteriaMustSatisfy;
    return builder;
  }

  @Override
  public void validate(Violations violations) {
    violations
        .required("Name", name)
        .nested("CustomOverride", customOverride)
        .each("Children", children)
        .each("Variables", variables);
  }

  /** Builder for {@link Rules}. */
  public static final class Builder {

    private String name;
    private String advancedOverride = "";
    private final List<RuleBehavior> behaviors = new ArrayList<>();
    private final List<Rules> children = new ArrayList<>();
    private String comments = "";
    private final List<RuleBehavior> criteria = new ArrayList<>();
    private boolean criteriaLocked;
    private @Nullable RuleCustomOverride customOverride;
    private RuleOptions options = RuleOptions.NONE;
    private String uuid = "";
    private String templateUuid = "";
    private String templateLink = "";
    private final List<RuleVariable> variables = new ArrayList<>();
    private @Nullable RuleCriteriaMustSatisfy criteriaMustSatisfy;

    private Builder(String name) {
      this.name = Objects.requireNonNull(name, "name");
    }

    public Builder name(String name) {
      this.name = Objects.requireNonNull(name, "name");
      return this;
    }

    public Builder advancedOverride(String advancedOverride) {
      this.advancedOverride = Objects.requireNonNull(advancedOverride, "advancedOverride");
      return this;
    }

    public Builder behavior(RuleBehavior behavior) {
      behaviors.add(Objects.requireNonNull(behavior, "behavior"));
      return this;
    }

    public Builder child(Rules child) {
      children.add(Objects.requireNonNull(child, "child"));
      return this;
    }

    public Builder comments(String comments) {
      this.comments = Objects.requireNonNull(comments, "comments");
      return this;
    }

    public Builder criterion(RuleBehavior criterion) {
      criteria.add(Objects.requireNonNull(criterion, "criterion"));
      return this;
    }

    public Builder criteriaLocked(boolean criteriaLocked) {
      this.criteriaLocked = criteriaLocked;
      return this;
    }

    public Builder customOverride(@Nullable RuleCustomOverride customOverride) {
      this.customOverride = customOverride;
      return this;
    }

    public Builder options(RuleOptions options) {
      this.options = Objects.requireNonNull(options, "options");
      return this;
    }

    public Builder uuid(String uuid) {
      this.uuid = Objects.requireNonNull(uuid, "uuid");
      return this;
    }

    public Builder templateUuid(String templateUuid) {
      this.templateUuid = Objects.requireNonNull(templateUuid, "templateUuid");
      return this;
    }

    public Builder templateLink(String templateLink) {
      this.templateLink = Objects.requireNonNull(templateLink, "templateLink");
      return this;
    }

    public Builder variable(RuleVariable variable) {
      variables.add(Objects.requireNonNull(variable, "variable"));
      return this;
    }

    public Builder criteriaMustSatisfy(@Nullable RuleCriteriaMustSatisfy criteriaMustSatisfy) {
      this.criteriaMustSatisfy = criteriaMustSatisfy;
      return this;
    }

    public Rules build() {
      return new Rules(
          advancedOverride,
          behaviors,
          children,
          comments,
          criteria,
          criteriaLocked,
          customOverride,
          name,
          options,
          uuid,
          templateUuid,
          templateLink,
          variables,
          criteriaMustSatisfy);
    }
  }
}
