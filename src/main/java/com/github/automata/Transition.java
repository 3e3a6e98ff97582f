package com.github.automata;

import java.util.Optional;

import com.github.automata.StateMachineException.Code;

/**
 * A directed, criteria guarded edge to the state named {@link #getTargetStateName()}. The target is
 * looked up by name only when the transition is exercised, so a transition may point at a state
 * that gets added to the machine later.
 *
 * Use the {@code TransitionBuilder} to build it. Literal criteria are normalized into a strict
 * equality {@link Criteria} at build time.
 */
public final class Transition {
  private final String targetStateName;
  private final Criteria criteria;
  private final Optional<Acceptor> acceptor;

  private Transition(final String targetStateName, final Criteria criteria,
      final Optional<Acceptor> acceptor) {
    this.targetStateName = targetStateName;
    this.criteria = criteria;
    this.acceptor = acceptor;
  }

  public String getTargetStateName() {
    return targetStateName;
  }

  public Criteria getCriteria() {
    return criteria;
  }

  public Optional<Acceptor> getAcceptor() {
    return acceptor;
  }

  boolean matches(final Object input, final Optional<State> previousState) {
    return criteria.test(input, previousState);
  }

  @Override
  public String toString() {
    return "Transition [targetStateName=" + targetStateName + ", accepting="
        + acceptor.isPresent() + "]";
  }

  public final static class TransitionBuilder {
    private String targetStateName;
    private Criteria criteria;
    private Acceptor acceptor;

    public static TransitionBuilder newBuilder() {
      return new TransitionBuilder();
    }

    public TransitionBuilder target(final String targetStateName) {
      this.targetStateName = targetStateName;
      return this;
    }

    public TransitionBuilder criteria(final Criteria criteria) {
      this.criteria = criteria;
      return this;
    }

    /**
     * Match inputs strictly equal to the given value.
     */
    public TransitionBuilder literal(final Object value) {
      this.criteria = value == null ? null : Criteria.literal(value);
      return this;
    }

    public TransitionBuilder accept(final Acceptor acceptor) {
      this.acceptor = acceptor;
      return this;
    }

    public Transition build() throws StateMachineException {
      if (targetStateName == null || targetStateName.trim().isEmpty()) {
        throw new StateMachineException(Code.INVALID_TRANSITION,
            "All outgoing transitions must have a target state specified by name");
      }
      if (criteria == null) {
        throw new StateMachineException(Code.INVALID_TRANSITION,
            "Transition to " + targetStateName + " has no criteria");
      }
      return new Transition(targetStateName, criteria, Optional.ofNullable(acceptor));
    }

    private TransitionBuilder() {}
  }

}
