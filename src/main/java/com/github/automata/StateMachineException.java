package com.github.automata;

/**
 * Unified single exception that's thrown by this FSM for structural problems: malformed states or
 * transitions, a broken graph or a machine that was driven before it had a root. The code enum
 * encapsulates the various error conditions.
 *
 * Runtime transition failures (dead ends, dangling targets) are never thrown, they are reported to
 * listeners as a {@link TransitionFailure} carrying one of the same codes.
 */
public final class StateMachineException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public StateMachineException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public StateMachineException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public StateMachineException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    INVALID_STATE_NAME("State name cannot be null or blank"),
    // 2.
    INVALID_STATE("State cannot be both the initial and a terminal state"),
    // 3.
    INVALID_TRANSITIONS("Transitions contain a null entry or belong to a terminal state"),
    // 4.
    INVALID_TRANSITION("Transition requires both a target state name and criteria"),
    // 5.
    DUPLICATE_STATE("A state with the same name has already been defined"),
    // 6.
    DUPLICATE_ROOT("The initial state of the machine has already been defined"),
    // 7.
    MACHINE_NOT_INITIALIZED("State machine has no initial state and cannot process input"),
    // 8.
    INVALID_MACHINE_CONFIG("State machine configuration is invalid"),
    // 9.
    NO_MATCHING_TRANSITION("No outgoing transition of the current state matched the input"),
    // 10.
    UNKNOWN_TARGET_STATE("Transition points at a state that does not exist in the machine");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
