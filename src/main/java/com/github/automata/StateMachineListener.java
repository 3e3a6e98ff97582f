package com.github.automata;

/**
 * Observer of a {@link StateMachine}. All callbacks are invoked synchronously on the thread driving
 * the machine, in the order the step produces them: values, state change, then reset. A failing
 * step reports its error before the reset that follows it.
 */
public interface StateMachineListener {

  default void onStateChange(final StateChange change) {}

  default void onReset(final ResetInfo reset) {}

  default void onValue(final Object value) {}

  default void onError(final TransitionFailure failure) {}

}
