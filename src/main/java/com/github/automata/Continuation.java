package com.github.automata;

/**
 * Callback handed to {@link StateMachine#next(Object, Continuation)}. It runs on the machine's
 * callback executor once the step has been committed and all its notifications were emitted.
 */
@FunctionalInterface
public interface Continuation {

  void onStep(final StepOutcome outcome);

}
