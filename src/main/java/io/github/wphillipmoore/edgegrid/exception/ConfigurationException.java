package io.github.wphillipmoore.edgegrid.exception;

import java.util.List;
import java.util.Objects;

/**
 * Thrown when a session or retry configuration is invalid. Nothing from the rejected configuration
 * is applied.
 */
public final class ConfigurationException extends EdgeGridException {

  private static final long serialVersionUID = 1L;

  private final List<String> problems;

  /**
   * Creates a configuration exception.
   *
   * @param prefix short description of what was being configured
   * @param problems every problem found, in discovery order (defensively copied)
   */
  public ConfigurationException(String prefix, List<String> problems) {
    super(
        Objects.requireNonNull(prefix, "prefix")
            + ": "
            + String.join("\n", Objects.requireNonNull(problems, "problems")));
    this.problems = List.copyOf(problems);
  }

  /** Returns every problem found, in discovery order. */
  public List<String> getProblems() {
    return problems;
  }
}
