package com.github.automata;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;

import org.junit.Test;

import com.github.automata.State.StateBuilder;
import com.github.automata.StateMachine.StateMachineBuilder;
import com.github.automata.StateMachineConfiguration.StateMachineConfigurationBuilder;
import com.github.automata.StateMachineTest.RecordingListener;
import com.github.automata.Transition.TransitionBuilder;

/**
 * The classic vending machine that only sells $0.10 candy bars and takes nickels and dimes. $0.10 is
 * a terminal, accepting state that hands out the candy. A dime on top of a nickel buys a candy bar
 * right away and keeps the nickel as credit.
 */
public final class VendingMachineStateMachineTest {
  private static final Map<String, Integer> candyBar = Collections.singletonMap("candyBars", 1);

  @Test
  public void testDimeBuysCandy() throws StateMachineException {
    final RecordingListener listener = new RecordingListener();
    final StateMachine vendingMachine = vendingMachine(listener);

    final StepOutcome outcome = vendingMachine.next(0.10);
    assertEquals("$0.10", outcome.getStateChange().get().getTo());
    assertEquals(Collections.singletonList(candyBar), outcome.getProducedValues());
    assertTrue(outcome.getReset().isPresent());
    assertEquals("$0.00", vendingMachine.currentStatus().getStateName());
    assertEquals(Collections.singletonList(new HistoryRecord("$0.00", null)),
        vendingMachine.currentStatus().getHistory());
  }

  @Test
  public void testTwoNickelsBuyCandy() throws StateMachineException {
    final RecordingListener listener = new RecordingListener();
    final StateMachine vendingMachine = vendingMachine(listener);

    assertEquals("$0.05", vendingMachine.next(0.05).getCurrentStateName());
    final StepOutcome outcome = vendingMachine.next(0.05);
    assertEquals("$0.10", outcome.getStateChange().get().getTo());
    assertEquals("$0.00", outcome.getCurrentStateName());
    assertEquals("$0.10", outcome.getReset().get().getPriorStateName());
    assertEquals(3, outcome.getReset().get().getHistory().size());
    assertEquals(Collections.singletonList(candyBar), listener.values);
  }

  @Test
  public void testDimeOnNickelKeepsCredit() throws StateMachineException {
    final RecordingListener listener = new RecordingListener();
    final StateMachine vendingMachine = vendingMachine(listener);

    vendingMachine.next(0.05);
    final StepOutcome outcome = vendingMachine.next(0.10);
    assertEquals("$0.05", outcome.getCurrentStateName());
    assertEquals(candyBar, outcome.getStateChange().get().getTransitionValue().get());
    assertFalse(outcome.getReset().isPresent());
    assertEquals(Collections.singletonList(candyBar), listener.values);

    // the nickel of credit plus another one still makes a dime
    vendingMachine.next(0.05);
    assertEquals(2, listener.values.size());
    assertEquals("$0.00", vendingMachine.currentStatus().getStateName());
  }

  @Test
  public void testNickelThenDimeReachesTerminal() throws StateMachineException {
    final RecordingListener listener = new RecordingListener();
    final StateMachine vendingMachine = StateMachineBuilder.newBuilder()
        .config(StateMachineConfigurationBuilder.newBuilder().name("nickel-dime").build())
        .listener(listener)
        .state(StateBuilder.newBuilder("$0.00").initial(true)
            .transition(TransitionBuilder.newBuilder().target("$0.05").literal(0.05).build())
            .transition(TransitionBuilder.newBuilder().target("$0.10").literal(0.10).build())
            .build())
        .state(StateBuilder.newBuilder("$0.05")
            .transition(TransitionBuilder.newBuilder().target("$0.10").literal(0.10).build())
            .build())
        .state(StateBuilder.newBuilder("$0.10").terminal(true)
            .accept((input, history) -> Optional.of(candyBar)).build())
        .build();

    vendingMachine.next(0.05);
    final StepOutcome outcome = vendingMachine.next(0.10);
    assertEquals("$0.05", outcome.getStateChange().get().getFrom());
    assertEquals("$0.10", outcome.getStateChange().get().getTo());
    assertEquals(Collections.singletonList(candyBar), outcome.getProducedValues());
    assertEquals(Collections.singletonList(candyBar), listener.values);

    final ResetInfo reset = outcome.getReset().get();
    assertEquals("$0.10", reset.getPriorStateName());
    assertEquals(Arrays.asList(new HistoryRecord("$0.00", null), new HistoryRecord("$0.05", 0.05),
        new HistoryRecord("$0.10", 0.10)), reset.getHistory());

    assertEquals("$0.00", vendingMachine.currentStatus().getStateName());
    assertEquals(Collections.singletonList(new HistoryRecord("$0.00", null)),
        vendingMachine.currentStatus().getHistory());
  }

  @Test
  public void testForeignCoinIsRejected() throws StateMachineException {
    final RecordingListener listener = new RecordingListener();
    final StateMachine vendingMachine = vendingMachine(listener);

    vendingMachine.next(0.05);
    // a float nickel is not strictly equal to a double nickel
    final StepOutcome outcome = vendingMachine.next(0.05f);
    assertFalse(outcome.isTransitioned());
    assertEquals("$0.00", outcome.getCurrentStateName());
    assertEquals(1, listener.failures.size());
    assertEquals(Float.valueOf(0.05f), listener.failures.get(0).getInput());
    assertTrue(listener.values.isEmpty());
  }

  static StateMachine vendingMachine(final StateMachineListener listener)
      throws StateMachineException {
    return StateMachineBuilder.newBuilder()
        .config(StateMachineConfigurationBuilder.newBuilder().name("vending-machine")
            .maxHistory(10).build())
        .listener(listener)
        .state(StateBuilder.newBuilder("$0.00").initial(true)
            .transition(TransitionBuilder.newBuilder().target("$0.05").literal(0.05).build())
            .transition(TransitionBuilder.newBuilder().target("$0.10").literal(0.10).build())
            .build())
        .state(StateBuilder.newBuilder("$0.05")
            .transition(TransitionBuilder.newBuilder().target("$0.10").literal(0.05).build())
            .transition(TransitionBuilder.newBuilder().target("$0.05").literal(0.10)
                .accept((input, history) -> Optional.of(candyBar)).build())
            .build())
        .state(StateBuilder.newBuilder("$0.10").terminal(true)
            .accept((input, history) -> Optional.of(candyBar)).build())
        .build();
  }

}
