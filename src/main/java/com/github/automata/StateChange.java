package com.github.automata;

import java.util.List;
import java.util.Optional;

/**
 * Describes one committed transition. The history is the one in effect right after the commit,
 * possibly truncated to the configured maximum. The transition value is whatever the exercised
 * transition's own {@link Acceptor} produced.
 */
public final class StateChange {
  private final String from;
  private final String to;
  private final Object input;
  private final List<HistoryRecord> history;
  private final Optional<Object> transitionValue;

  StateChange(final String from, final String to, final Object input,
      final List<HistoryRecord> history, final Optional<Object> transitionValue) {
    this.from = from;
    this.to = to;
    this.input = input;
    this.history = history;
    this.transitionValue = transitionValue;
  }

  public String getFrom() {
    return from;
  }

  public String getTo() {
    return to;
  }

  public Object getInput() {
    return input;
  }

  public List<HistoryRecord> getHistory() {
    return history;
  }

  public Optional<Object> getTransitionValue() {
    return transitionValue;
  }

  @Override
  public String toString() {
    return "StateChange [from=" + from + ", to=" + to + ", input=" + input + ", transitionValue="
        + transitionValue + ", history=" + history + "]";
  }
}
