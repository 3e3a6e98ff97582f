package com.github.automata;

import java.util.List;

/**
 * Read-only snapshot of where the machine is and how it got there since the last reset.
 */
public final class MachineStatus {
  private final String stateName;
  private final List<HistoryRecord> history;

  MachineStatus(final String stateName, final List<HistoryRecord> history) {
    this.stateName = stateName;
    this.history = history;
  }

  public String getStateName() {
    return stateName;
  }

  public List<HistoryRecord> getHistory() {
    return history;
  }

  @Override
  public String toString() {
    return "MachineStatus [stateName=" + stateName + ", history=" + history + "]";
  }
}
