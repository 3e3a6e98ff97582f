package com.github.automata;

import java.util.Objects;

/**
 * One entry of the machine's history: a state that was entered and the input that led there. The
 * root record written by a reset carries a null input.
 */
public final class HistoryRecord {
  private final String stateName;
  private final Object input;

  public HistoryRecord(final String stateName, final Object input) {
    this.stateName = stateName;
    this.input = input;
  }

  public String getStateName() {
    return stateName;
  }

  public Object getInput() {
    return input;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof HistoryRecord)) {
      return false;
    }
    HistoryRecord other = (HistoryRecord) o;
    return Objects.equals(stateName, other.stateName) && Objects.equals(input, other.input);
  }

  @Override
  public int hashCode() {
    return Objects.hash(stateName, input);
  }

  @Override
  public String toString() {
    return "HistoryRecord [stateName=" + stateName + ", input=" + input + "]";
  }
}
