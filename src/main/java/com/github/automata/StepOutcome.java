package com.github.automata;

import java.util.List;
import java.util.Optional;

/**
 * This object encapsulates everything one call to {@link StateMachine#next(Object)} did: the values
 * produced by accepting states and transitions, the committed state change, the reset the step
 * triggered and where the machine ended up.
 *
 * A dead end step has no state change, no values and always carries a reset.
 */
public final class StepOutcome {
  private final List<Object> producedValues;
  private final Optional<StateChange> stateChange;
  private final Optional<ResetInfo> reset;
  private final String currentStateName;
  private final List<HistoryRecord> history;

  StepOutcome(final List<Object> producedValues, final Optional<StateChange> stateChange,
      final Optional<ResetInfo> reset, final String currentStateName,
      final List<HistoryRecord> history) {
    this.producedValues = producedValues;
    this.stateChange = stateChange;
    this.reset = reset;
    this.currentStateName = currentStateName;
    this.history = history;
  }

  public List<Object> getProducedValues() {
    return producedValues;
  }

  public Optional<StateChange> getStateChange() {
    return stateChange;
  }

  public Optional<ResetInfo> getReset() {
    return reset;
  }

  public String getCurrentStateName() {
    return currentStateName;
  }

  public List<HistoryRecord> getHistory() {
    return history;
  }

  public boolean isTransitioned() {
    return stateChange.isPresent();
  }

  @Override
  public String toString() {
    return "StepOutcome [producedValues=" + producedValues + ", stateChange=" + stateChange
        + ", reset=" + reset + ", currentStateName=" + currentStateName + ", history=" + history
        + "]";
  }
}
