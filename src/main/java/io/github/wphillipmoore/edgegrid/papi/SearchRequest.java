package io.github.wphillipmoore.edgegrid.papi;

import io.github.wphillipmoore.edgegrid.validation.Validatable;
import io.github.wphillipmoore.edgegrid.validation.Violations;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Parameters of {@link PapiClient#searchProperties}: find property versions by one attribute.
 *
 * @param key the attribute, one of {@link #PROPERTY_NAME}, {@link #HOSTNAME} or {@link
 *     #EDGE_HOSTNAME}
 * @param value the value to look for
 */
public record SearchRequest(String key, String value) implements Validatable {

  /** Search by property name. */
  public static final String PROPERTY_NAME = "propertyName";

  /** Search by hostname. */
  public static final String HOSTNAME = "hostname";

  /** Search by edge hostname. */
  public static final String EDGE_HOSTNAME = "edgeHostname";

  static final Set<String> KEYS = Set.of(PROPERTY_NAME, HOSTNAME, EDGE_HOSTNAME);

  /** Replaces null fields with empty strings. */
  public SearchRequest {
    key = Objects.requireNonNullElse(key, "");
    value = Objects.requireNonNullElse(value, "");
  }

  /** Returns the request body, a single {@code key: value} member. */
  Map<String, String> body() {
    return Map.of(key, value);
  }

  @Override
  public void validate(Violations violations) {
    violations
        .required("SearchKey", key)
        .oneOf("SearchKey", key, KEYS)
        .required("SearchValue", value);
  }
}
