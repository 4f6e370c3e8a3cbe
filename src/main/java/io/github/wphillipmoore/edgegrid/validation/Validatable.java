package io.github.wphillipmoore.edgegrid.validation;

import io.github.wphillipmoore.edgegrid.exception.ValidationException;

/**
 * A request-shaped value that can check its own structure before it is sent.
 *
 * <p>Implementations declare their rules against the supplied {@link Violations}; they must not
 * mutate themselves or perform I/O.
 */
public interface Validatable {

  /**
   * Records every rule violation of this value into {@code violations}.
   *
   * @param violations collector scoped to this value's field path
   */
  void validate(Violations violations);

  /**
   * Validates this value and throws if anything is wrong.
   *
   * @param operation short name of the operation, used as the message prefix
   * @throws ValidationException listing every violation found
   */
  default void validateOrThrow(String operation) {
    Violations violations = new Violations();
    validate(violations);
    violations.throwIfAny(operation);
  }
}
