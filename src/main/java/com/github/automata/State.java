package com.github.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.github.automata.StateMachineException.Code;

/**
 * This object represents an immutable node of the state graph. Use the {@code StateBuilder} to build
 * it, the builder validates the shape of the state.
 *
 * Notes:<br>
 * 1. the order of the outgoing transitions is their match priority, the machine takes the first
 * one whose criteria holds and does not look any further<br>
 * 2. a terminal state has no outgoing transitions, entering it resets the machine<br>
 * 3. a state with an {@link Acceptor} produces a value every time it is entered<br>
 */
public final class State {
  private final String name;
  private final boolean initial;
  private final boolean terminal;
  private final List<Transition> transitions;
  private final Optional<Acceptor> acceptor;

  private State(final String name, final boolean initial, final boolean terminal,
      final List<Transition> transitions, final Optional<Acceptor> acceptor) {
    this.name = name;
    this.initial = initial;
    this.terminal = terminal;
    this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
    this.acceptor = acceptor;
  }

  public String getName() {
    return name;
  }

  /**
   * Is this the root node?
   */
  public boolean isInitial() {
    return initial;
  }

  /**
   * Does entering this node reset the machine?
   */
  public boolean isTerminal() {
    return terminal;
  }

  public List<Transition> getTransitions() {
    return transitions;
  }

  public Optional<Acceptor> getAcceptor() {
    return acceptor;
  }

  public boolean isAccepting() {
    return acceptor.isPresent();
  }

  @Override
  public String toString() {
    return "State [name=" + name + ", initial=" + initial + ", terminal=" + terminal
        + ", transitions=" + transitions.size() + ", accepting=" + acceptor.isPresent() + "]";
  }

  public final static class StateBuilder {
    private String name;
    private boolean initial;
    private boolean terminal;
    private final List<Transition> transitions = new ArrayList<>();
    private Acceptor acceptor;

    public static StateBuilder newBuilder(final String name) {
      return new StateBuilder().name(name);
    }

    public StateBuilder name(final String name) {
      this.name = name;
      return this;
    }

    public StateBuilder initial(final boolean initial) {
      this.initial = initial;
      return this;
    }

    public StateBuilder terminal(final boolean terminal) {
      this.terminal = terminal;
      return this;
    }

    public StateBuilder transition(final Transition transition) {
      this.transitions.add(transition);
      return this;
    }

    public StateBuilder transitions(final List<Transition> transitions) {
      if (transitions != null) {
        this.transitions.addAll(transitions);
      }
      return this;
    }

    public StateBuilder accept(final Acceptor acceptor) {
      this.acceptor = acceptor;
      return this;
    }

    public State build() throws StateMachineException {
      validate();
      return new State(name, initial, terminal, transitions, Optional.ofNullable(acceptor));
    }

    private void validate() throws StateMachineException {
      if (name == null || name.trim().isEmpty()) {
        throw new StateMachineException(Code.INVALID_STATE_NAME);
      }
      if (initial && terminal) {
        throw new StateMachineException(Code.INVALID_STATE,
            "State " + name + " cannot be both a terminal node and the root node");
      }
      for (final Transition transition : transitions) {
        if (transition == null) {
          throw new StateMachineException(Code.INVALID_TRANSITIONS,
              "State " + name + " has a null outgoing transition");
        }
      }
      if (terminal && !transitions.isEmpty()) {
        throw new StateMachineException(Code.INVALID_TRANSITIONS,
            "State " + name + " cannot be terminal and have outgoing transitions");
      }
    }

    private StateBuilder() {}
  }

}
