package com.github.automata;

import com.github.automata.StateMachineException.Code;

/**
 * A non-fatal runtime failure raised while resolving a transition. The machine recovers from it by
 * resetting itself to the root within the same step.
 */
public final class TransitionFailure {
  private final Code code;
  private final String message;
  private final String currentStateName;
  private final Object input;

  TransitionFailure(final Code code, final String message, final String currentStateName,
      final Object input) {
    this.code = code;
    this.message = message;
    this.currentStateName = currentStateName;
    this.input = input;
  }

  public Code getCode() {
    return code;
  }

  public String getMessage() {
    return message;
  }

  public String getCurrentStateName() {
    return currentStateName;
  }

  public Object getInput() {
    return input;
  }

  @Override
  public String toString() {
    return "TransitionFailure [code=" + code + ", message=" + message + ", currentStateName="
        + currentStateName + ", input=" + input + "]";
  }
}
