package com.github.automata;

/**
 * Holder of running counters for a single FSM. Like the machine itself, this is not meant to be
 * updated from more than one thread at a time.
 */
public final class StateMachineStatistics {
  private final String machineId;
  private final long startTstampMillis = System.currentTimeMillis();

  long totalSteps;
  long totalTransitions;
  long totalValues;
  long totalResets;
  long totalFailures;

  StateMachineStatistics(final String machineId) {
    this.machineId = machineId;
  }

  public String getMachineId() {
    return machineId;
  }

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  /**
   * Number of inputs fed through next(), including the ones that hit a dead end.
   */
  public long getTotalSteps() {
    return totalSteps;
  }

  public long getTotalTransitions() {
    return totalTransitions;
  }

  public long getTotalValues() {
    return totalValues;
  }

  public long getTotalResets() {
    return totalResets;
  }

  public long getTotalFailures() {
    return totalFailures;
  }

  @Override
  public String toString() {
    return "StateMachineStatistics [machineId=" + machineId + ", startTstampMillis="
        + startTstampMillis + ", totalSteps=" + totalSteps + ", totalTransitions="
        + totalTransitions + ", totalValues=" + totalValues + ", totalResets=" + totalResets
        + ", totalFailures=" + totalFailures + "]";
  }

}
