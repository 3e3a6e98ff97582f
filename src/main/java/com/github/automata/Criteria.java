package com.github.automata;

import java.util.Objects;
import java.util.Optional;

/**
 * Match predicate guarding a {@link Transition}. The previous state is the one the machine occupied
 * before its last transition and is empty right after a reset.
 */
@FunctionalInterface
public interface Criteria {

  boolean test(final Object input, final Optional<State> previousState);

  /**
   * Strict equality against a literal: both values must be of the same class and equal, so
   * {@code 1} never matches {@code 1L} and {@code 0.1f} never matches {@code 0.1d}. Floating point
   * values compare numerically: {@code NaN} matches nothing and {@code 0.0} matches {@code -0.0}.
   */
  static Criteria literal(final Object expected) {
    return (input, previousState) -> input != null && expected != null
        && input.getClass() == expected.getClass() && strictlyEqual(expected, input);
  }

  private static boolean strictlyEqual(final Object expected, final Object input) {
    if (expected instanceof Double) {
      return ((Double) expected).doubleValue() == ((Double) input).doubleValue();
    }
    if (expected instanceof Float) {
      return ((Float) expected).floatValue() == ((Float) input).floatValue();
    }
    return Objects.equals(expected, input);
  }

  static Criteria always() {
    return (input, previousState) -> true;
  }

}
