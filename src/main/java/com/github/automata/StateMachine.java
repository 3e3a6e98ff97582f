package com.github.automata;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A simple deterministic Finite State Machine. Callers define a graph of named states with ordered,
 * criteria guarded transitions and then feed it one input at a time.
 *
 * Notes for users:<br>
 * 0. one input in, at most one transition out. A step either commits a single transition or
 * resets the machine, it never leaves it in between<br>
 *
 * 1. this FSM instance is NOT thread-safe. It is meant to be driven by one logical caller feeding
 * input one unit at a time; concurrent callers must serialize next(), reset() and addState()
 * themselves<br>
 *
 * 2. transitions are resolved first-match in declaration order. The machine is only deterministic
 * if the criteria of a state's transitions are mutually exclusive, nothing checks this for the
 * caller. Put the most probable transitions first<br>
 *
 * 3. transition targets are looked up by name when the transition is taken, so a graph can be built
 * incrementally. Use {@link #validateGraph()} to check all the targets upfront<br>
 *
 * 4. structural mistakes (bad states, duplicate names or roots) throw a
 * {@link StateMachineException}. Runtime dead ends never throw, they are reported to listeners and
 * the machine resets itself to the root<br>
 *
 * 5. entering a terminal state, or the root when resetAtRoot is configured, resets the machine<br>
 *
 * @author gaurav
 */
public interface StateMachine {

  /**
   * Add a state to the graph. The first initial state becomes the root and the machine is set to
   * it, a second initial state is rejected.
   */
  StateMachine addState(final State state) throws StateMachineException;

  /**
   * Add states in the given order.
   */
  StateMachine addStates(final List<State> states) throws StateMachineException;

  /**
   * Feed one input to the machine and return what the step did.
   */
  StepOutcome next(final Object input) throws StateMachineException;

  /**
   * Same as {@link #next(Object)} but also hands the outcome to the continuation once the step has
   * been committed and all its notifications were emitted. The continuation never runs inside this
   * call.
   */
  StepOutcome next(final Object input, final Continuation continuation)
      throws StateMachineException;

  /**
   * Send the machine back to its root and start a fresh history. Calling it repeatedly is harmless.
   */
  ResetInfo reset() throws StateMachineException;

  /**
   * Read/report the current state of the state machine and its history since the last reset.
   */
  MachineStatus currentStatus() throws StateMachineException;

  /**
   * Lookup a State by its name.
   */
  Optional<State> getStateByName(final String name);

  /**
   * Eagerly check that the machine has a root and that every transition points at a known state.
   */
  void validateGraph() throws StateMachineException;

  void addListener(final StateMachineListener listener);

  void removeListener(final StateMachineListener listener);

  /**
   * Reports the id of this StateMachine instance. You can have as many instances as you like.
   */
  String getId();

  String getName();

  /**
   * Returns the config that this fsm is wired with.
   */
  StateMachineConfiguration getConfiguration();

  /**
   * Report statistics for this FSM
   */
  StateMachineStatistics getStatistics();

  /**
   * A simple builder to let users use fluent APIs to build FSMs.
   */
  public final static class StateMachineBuilder {
    private StateMachineConfiguration config;
    private final List<State> states = new ArrayList<>();
    private final List<StateMachineListener> listeners = new ArrayList<>();

    public static StateMachineBuilder newBuilder() {
      return new StateMachineBuilder();
    }

    public StateMachineBuilder config(final StateMachineConfiguration config) {
      this.config = config;
      return this;
    }

    public StateMachineBuilder state(final State state) {
      this.states.add(state);
      return this;
    }

    public StateMachineBuilder states(final List<State> states) {
      this.states.addAll(states);
      return this;
    }

    public StateMachineBuilder listener(final StateMachineListener listener) {
      this.listeners.add(listener);
      return this;
    }

    public StateMachine build() throws StateMachineException {
      final StateMachineConfiguration machineConfig =
          config != null ? config : StateMachineConfiguration.StateMachineConfigurationBuilder
              .newBuilder().build();
      final StateMachine machine = new StateMachineImpl(machineConfig);
      for (final StateMachineListener listener : listeners) {
        machine.addListener(listener);
      }
      machine.addStates(states);
      return machine;
    }

    private StateMachineBuilder() {}
  }

}
