package com.github.automata;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * This class encapsulates all the configuration parameters for the StateMachine. Use the
 * {@code StateMachineConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. name is a diagnostic label that shows up in log lines and error messages<br>
 * 2. maxHistory bounds the history to a sliding window of the most recent records. Set it for cyclic
 * machines that never reach a terminal state, 0 leaves the history unbounded<br>
 * 3. resetAtRoot resets the machine every time a transition lands back on the initial state<br>
 * 4. continuations passed to next() run on the callbackExecutor. If none is set, a single shared
 * daemon thread runs them in submission order<br>
 *
 * @author gaurav
 */
public final class StateMachineConfiguration {
  private static final ExecutorService sharedCallbackDispatcher =
      Executors.newSingleThreadExecutor(runnable -> {
        final Thread dispatcher = new Thread(runnable, "fsm-callback-dispatcher");
        dispatcher.setDaemon(true);
        return dispatcher;
      });

  private final String name;
  private final int maxHistory;
  private final boolean resetAtRoot;
  private final Executor callbackExecutor;

  public String getName() {
    return name;
  }

  public int getMaxHistory() {
    return maxHistory;
  }

  public boolean isHistoryBounded() {
    return maxHistory > 0;
  }

  public boolean getResetAtRoot() {
    return resetAtRoot;
  }

  public Executor getCallbackExecutor() {
    return callbackExecutor;
  }

  public final static class StateMachineConfigurationBuilder {
    private String name = "fsm";
    private int maxHistory;
    private boolean resetAtRoot;
    private Executor callbackExecutor;

    public static StateMachineConfigurationBuilder newBuilder() {
      return new StateMachineConfigurationBuilder();
    }

    public StateMachineConfigurationBuilder name(final String name) {
      this.name = name;
      return this;
    }

    public StateMachineConfigurationBuilder maxHistory(final int maxHistory) {
      this.maxHistory = maxHistory;
      return this;
    }

    public StateMachineConfigurationBuilder resetAtRoot(final boolean resetAtRoot) {
      this.resetAtRoot = resetAtRoot;
      return this;
    }

    public StateMachineConfigurationBuilder callbackExecutor(final Executor callbackExecutor) {
      this.callbackExecutor = callbackExecutor;
      return this;
    }

    public StateMachineConfiguration build() throws StateMachineException {
      final StateMachineConfiguration config = new StateMachineConfiguration(name, maxHistory,
          resetAtRoot, callbackExecutor == null ? sharedCallbackDispatcher : callbackExecutor);
      config.validate();
      return config;
    }

    private StateMachineConfigurationBuilder() {}
  }

  private void validate() throws StateMachineException {
    StringBuilder messages = new StringBuilder();
    if (name == null || name.trim().isEmpty()) {
      messages.append("Name cannot be null or blank. ");
    }
    if (maxHistory < 0) {
      messages.append("MaxHistory cannot be negative. ");
    }
    if (messages.length() > 0) {
      throw new StateMachineException(StateMachineException.Code.INVALID_MACHINE_CONFIG,
          messages.toString());
    }
  }

  @Override
  public String toString() {
    return "StateMachineConfiguration [name=" + name + ", maxHistory=" + maxHistory
        + ", resetAtRoot=" + resetAtRoot + "]";
  }

  private StateMachineConfiguration(final String name, final int maxHistory,
      final boolean resetAtRoot, final Executor callbackExecutor) {
    this.name = name;
    this.maxHistory = maxHistory;
    this.resetAtRoot = resetAtRoot;
    this.callbackExecutor = callbackExecutor;
  }

}
