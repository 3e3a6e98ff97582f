package com.github.automata;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automata.StateMachineException.Code;

/**
 * A simple deterministic Finite State Machine.
 *
 * Notes for users:<br>
 * 1. this FSM instance is not thread-safe, there is no locking around the current state, the
 * previous state and the history. The graph itself is append-only, so reading its shape from many
 * threads after setup is fine<br>
 *
 * 2. a step either commits a transition or, when nothing matches, reports a failure and resets the
 * machine. There's no partially applied step other than one aborted by an exception thrown from
 * caller supplied criteria, acceptors or listeners<br>
 *
 * 3. the history always starts with the root record written by the last reset. With maxHistory
 * set, the oldest records are evicted first<br>
 *
 * @author gaurav
 */
public final class StateMachineImpl implements StateMachine {
  private static final Logger logger = LogManager.getLogger(StateMachineImpl.class.getSimpleName());

  private final String machineId = UUID.randomUUID().toString();
  private final StateMachineConfiguration config;

  // K=state.name, V=state. Append-only, insertion order only matters for diagnostics.
  private final Map<String, State> states = new LinkedHashMap<>();

  private final List<StateMachineListener> listeners = new CopyOnWriteArrayList<>();

  private final StateMachineStatistics machineStats;

  private State root;
  private State currentState;
  // null right after a reset
  private State previousState;
  private final Deque<HistoryRecord> history = new ArrayDeque<>();

  public StateMachineImpl(final StateMachineConfiguration config) throws StateMachineException {
    if (config == null) {
      throw new StateMachineException(Code.INVALID_MACHINE_CONFIG);
    }
    this.config = config;
    this.machineStats = new StateMachineStatistics(machineId);
    logInfo(config.getName(), "Fired up state machine with " + config);
  }

  @Override
  public StateMachine addState(final State state) throws StateMachineException {
    if (state == null) {
      throw new StateMachineException(Code.INVALID_STATE, "Null state is invalid");
    }
    if (states.containsKey(state.getName())) {
      throw new StateMachineException(Code.DUPLICATE_STATE,
          fatalMessage("The state \"" + state.getName() + "\" has already been defined"));
    }
    if (state.isInitial() && root != null) {
      throw new StateMachineException(Code.DUPLICATE_ROOT,
          fatalMessage("Cannot redefine root node with state: " + state.getName()));
    }
    states.put(state.getName(), state);
    if (state.isInitial()) {
      root = state;
      currentState = root;
      previousState = null;
      history.clear();
      history.add(new HistoryRecord(root.getName(), null));
    }
    logInfo(config.getName(), "Added " + state);
    return this;
  }

  @Override
  public StateMachine addStates(final List<State> states) throws StateMachineException {
    if (states == null) {
      throw new StateMachineException(Code.INVALID_STATE,
          fatalMessage("addStates() must be called with a list of states"));
    }
    for (final State state : states) {
      addState(state);
    }
    return this;
  }

  @Override
  public StepOutcome next(final Object input) throws StateMachineException {
    return next(input, null);
  }

  @Override
  public StepOutcome next(final Object input, final Continuation continuation)
      throws StateMachineException {
    machineInitialized();
    machineStats.totalSteps++;

    final State fromState = currentState;
    final Edge edge = findNextState(input, fromState, Optional.ofNullable(previousState));

    // dead end, the only way out is back to the root
    if (edge == null) {
      reportFailure(Code.NO_MATCHING_TRANSITION, "Cannot find valid transition from: \""
          + fromState.getName() + "\" with input: " + input, fromState, input);
      final ResetInfo resetInfo = reset();
      return complete(new StepOutcome(Collections.emptyList(), Optional.empty(),
          Optional.of(resetInfo), currentState.getName(), snapshotHistory()), continuation);
    }

    final List<Object> producedValues = new ArrayList<>();
    final State nextState = edge.target;
    if (nextState.getAcceptor().isPresent()) {
      accept(nextState.getAcceptor().get(), input).ifPresent(producedValues::add);
    }

    final StateChange stateChange = transition(input, edge, producedValues);

    Optional<ResetInfo> resetInfo = Optional.empty();
    if (nextState.isTerminal() || (nextState.isInitial() && config.getResetAtRoot())) {
      resetInfo = Optional.of(reset());
    }

    return complete(new StepOutcome(Collections.unmodifiableList(producedValues),
        Optional.of(stateChange), resetInfo, currentState.getName(), snapshotHistory()),
        continuation);
  }

  @Override
  public ResetInfo reset() throws StateMachineException {
    machineInitialized();
    final State finalState = currentState;
    final List<HistoryRecord> finishedHistory = snapshotHistory();

    previousState = null;
    currentState = root;
    history.clear();
    history.add(new HistoryRecord(root.getName(), null));
    machineStats.totalResets++;

    final ResetInfo resetInfo = new ResetInfo(finalState.getName(), finishedHistory);
    logDebug(config.getName(), "Reset machine from " + finalState.getName());
    for (final StateMachineListener listener : listeners) {
      listener.onReset(resetInfo);
    }
    return resetInfo;
  }

  @Override
  public MachineStatus currentStatus() throws StateMachineException {
    machineInitialized();
    return new MachineStatus(currentState.getName(), snapshotHistory());
  }

  @Override
  public Optional<State> getStateByName(final String name) {
    return Optional.ofNullable(states.get(name));
  }

  @Override
  public void validateGraph() throws StateMachineException {
    machineInitialized();
    for (final State state : states.values()) {
      for (final Transition transition : state.getTransitions()) {
        if (!states.containsKey(transition.getTargetStateName())) {
          throw new StateMachineException(Code.UNKNOWN_TARGET_STATE,
              fatalMessage("The state: \"" + state.getName()
                  + "\" specified an outbound transition that does not exist: \""
                  + transition.getTargetStateName() + "\""));
        }
      }
    }
    logInfo(config.getName(), "Validated graph of " + states.size() + " states");
  }

  @Override
  public void addListener(final StateMachineListener listener) {
    if (listener != null) {
      listeners.add(listener);
    }
  }

  @Override
  public void removeListener(final StateMachineListener listener) {
    listeners.remove(listener);
  }

  @Override
  public String getId() {
    return machineId;
  }

  @Override
  public String getName() {
    return config.getName();
  }

  @Override
  public StateMachineConfiguration getConfiguration() {
    return config;
  }

  @Override
  public StateMachineStatistics getStatistics() {
    return machineStats;
  }

  /**
   * Loops through the outbound transitions in declaration order and returns the first one whose
   * criteria holds, without testing the rest. A transition whose target is not registered is
   * reported as a failure and ends the search without a match.
   */
  private Edge findNextState(final Object input, final State fromState,
      final Optional<State> previous) {
    for (final Transition transition : fromState.getTransitions()) {
      final State target = states.get(transition.getTargetStateName());
      if (target == null) {
        reportFailure(Code.UNKNOWN_TARGET_STATE,
            "The current state: \"" + fromState.getName()
                + "\" specified an outbound transition that does not exist: \""
                + transition.getTargetStateName() + "\"",
            fromState, input);
        return null;
      }
      if (transition.matches(input, previous)) {
        return new Edge(transition, target);
      }
    }
    return null;
  }

  /**
   * Commits the transition. The transition's own acceptor fires before the machine moves, with the
   * same history the target state's acceptor saw.
   */
  private StateChange transition(final Object input, final Edge edge,
      final List<Object> producedValues) {
    Optional<Object> transitionValue = Optional.empty();
    if (edge.transition.getAcceptor().isPresent()) {
      transitionValue = accept(edge.transition.getAcceptor().get(), input);
      transitionValue.ifPresent(producedValues::add);
    }

    final State fromState = currentState;
    previousState = fromState;
    currentState = edge.target;
    history.addLast(new HistoryRecord(edge.target.getName(), input));
    if (config.isHistoryBounded() && history.size() > config.getMaxHistory()) {
      history.removeFirst();
    }
    machineStats.totalTransitions++;

    final StateChange stateChange = new StateChange(fromState.getName(), edge.target.getName(),
        input, snapshotHistory(), transitionValue);
    logDebug(config.getName(), String.format("Transitioned from %s->%s on input: %s",
        fromState.getName(), edge.target.getName(), input));
    for (final StateMachineListener listener : listeners) {
      listener.onStateChange(stateChange);
    }
    return stateChange;
  }

  /**
   * Runs an acceptor and emits its value, if it produced one.
   */
  private Optional<Object> accept(final Acceptor acceptor, final Object input) {
    Optional<Object> value = acceptor.accept(input, snapshotHistory());
    if (value == null) {
      value = Optional.empty();
    }
    if (value.isPresent()) {
      machineStats.totalValues++;
      for (final StateMachineListener listener : listeners) {
        listener.onValue(value.get());
      }
    }
    return value;
  }

  private StepOutcome complete(final StepOutcome outcome, final Continuation continuation) {
    if (continuation != null) {
      final String machineName = config.getName();
      config.getCallbackExecutor().execute(() -> {
        try {
          continuation.onStep(outcome);
        } catch (RuntimeException problem) {
          logError(machineName, "Continuation failed for step ending in "
              + outcome.getCurrentStateName(), problem);
        }
      });
    }
    return outcome;
  }

  private void reportFailure(final Code code, final String message, final State state,
      final Object input) {
    machineStats.totalFailures++;
    final TransitionFailure failure =
        new TransitionFailure(code, fatalMessage(message), state.getName(), input);
    logWarning(config.getName(), message);
    for (final StateMachineListener listener : listeners) {
      listener.onError(failure);
    }
  }

  private List<HistoryRecord> snapshotHistory() {
    return Collections.unmodifiableList(new ArrayList<>(history));
  }

  private void machineInitialized() throws StateMachineException {
    if (root == null) {
      throw new StateMachineException(Code.MACHINE_NOT_INITIALIZED,
          fatalMessage("Cannot start processing data without a starting state"));
    }
  }

  private String fatalMessage(final String message) {
    return "[m:" + config.getName() + "] " + message;
  }

  private static void logError(final String machineName, final String message,
      final Throwable error) {
    logger.error(new StringBuilder().append("[m:").append(machineName).append("] ")
        .append(message).toString(), error);
  }

  private static void logWarning(final String machineName, final String message) {
    logger.warn(new StringBuilder().append("[m:").append(machineName).append("] ")
        .append(message).toString());
  }

  private static void logInfo(final String machineName, final String message) {
    logger.info(new StringBuilder().append("[m:").append(machineName).append("] ")
        .append(message).toString());
  }

  private static void logDebug(final String machineName, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(machineName).append("] ")
          .append(message).toString());
    }
  }

  /**
   * A resolved transition along with the state it leads to.
   */
  private final static class Edge {
    private final Transition transition;
    private final State target;

    private Edge(final Transition transition, final State target) {
      this.transition = transition;
      this.target = target;
    }
  }

}
