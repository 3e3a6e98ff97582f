package com.github.automata;

import java.util.List;

/**
 * Reported whenever the machine goes back to its root: the state it was in right before the reset
 * and the history accumulated since the previous reset.
 */
public final class ResetInfo {
  private final String priorStateName;
  private final List<HistoryRecord> history;

  ResetInfo(final String priorStateName, final List<HistoryRecord> history) {
    this.priorStateName = priorStateName;
    this.history = history;
  }

  public String getPriorStateName() {
    return priorStateName;
  }

  public List<HistoryRecord> getHistory() {
    return history;
  }

  @Override
  public String toString() {
    return "ResetInfo [priorStateName=" + priorStateName + ", history=" + history + "]";
  }
}
