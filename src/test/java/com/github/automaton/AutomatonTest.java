package com.github.automaton;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Optional;

import org.junit.Test;

import com.github.automaton.Automaton.AutomatonBuilder;
import com.github.automaton.AutomatonConfiguration.AutomatonConfigurationBuilder;
import com.github.automaton.AutomatonException.Code;

/**
 * Tests to maintain the sanity of automaton construction and its error handling.
 */
public class AutomatonTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testAddStateUpserts() throws AutomatonException {
    final Automaton automaton = new AutomatonImpl();
    automaton.addState(1, Optional.of("one"), false, false);
    automaton.addState(1, false, true);

    assertEquals(1, automaton.getStates().size());
    final State state = automaton.findState(1).get();
    assertEquals("one", state.getName());
    assertTrue(state.isAccepting());
    assertFalse(state.isStart());
  }

  @Test
  public void testUnnamedStateIsNamedById() throws AutomatonException {
    final Automaton automaton = new AutomatonImpl();
    automaton.addState(42, false, false);
    assertEquals("42", automaton.findState(42).get().getName());
    assertFalse(automaton.findState(7).isPresent());
  }

  @Test
  public void testStatesOrderedById() throws AutomatonException {
    final Automaton automaton =
        AutomatonBuilder.newBuilder().states(5, 3, 9, 0).state(1, true, false).build();
    final int[] ids = automaton.getStates().stream().mapToInt(State::getId).toArray();
    assertTrue(Arrays.equals(new int[] {0, 1, 3, 5, 9}, ids));
  }

  @Test
  public void testDuplicateStartRejectedByDefault() throws AutomatonException {
    final Automaton automaton = new AutomatonImpl();
    automaton.addState(0, true, false);
    try {
      automaton.addState(1, true, true);
      fail("Expected DUPLICATE_START");
    } catch (AutomatonException expected) {
      assertEquals(Code.DUPLICATE_START, expected.getCode());
    }
    // nothing was written by the failed call
    assertEquals(1, automaton.getStates().size());
    assertFalse(automaton.findState(1).isPresent());
    assertEquals(0, automaton.getStartState().get().getId());

    // re-marking the same state as start is fine
    automaton.addState(0, true, true);
    assertEquals(0, automaton.getStartState().get().getId());
    assertTrue(automaton.getStartState().get().isAccepting());
  }

  @Test
  public void testDuplicateStartReplaced() throws AutomatonException {
    final AutomatonConfiguration config = AutomatonConfigurationBuilder.newBuilder()
        .startStatePolicy(StartStatePolicy.REPLACE).build();
    final Automaton automaton = AutomatonBuilder.newBuilder().config(config)
        .state(0, true, false).state(1, true, true).build();

    assertEquals(1, automaton.getStartState().get().getId());
    assertFalse(automaton.findState(0).get().isStart());
    assertEquals(1, automaton.getStates().stream().filter(State::isStart).count());
  }

  @Test
  public void testUnmarkingStartClearsIt() throws AutomatonException {
    final Automaton automaton = new AutomatonImpl();
    automaton.addState(0, true, true);
    automaton.addState(0, false, true);
    assertFalse(automaton.getStartState().isPresent());

    // a different state may now become start
    automaton.addState(1, true, false);
    assertEquals(1, automaton.getStartState().get().getId());
  }

  @Test
  public void testTransitionToUnknownState() throws AutomatonException {
    final Automaton automaton = new AutomatonImpl();
    automaton.addState(0, true, false);
    try {
      automaton.addTransition(0, 1, 'a');
      fail("Expected UNKNOWN_STATE");
    } catch (AutomatonException expected) {
      assertEquals(Code.UNKNOWN_STATE, expected.getCode());
    }
    try {
      automaton.addEpsilonTransition(3, 0);
      fail("Expected UNKNOWN_STATE");
    } catch (AutomatonException expected) {
      assertEquals(Code.UNKNOWN_STATE, expected.getCode());
    }
    assertTrue(automaton.getTransitions().isEmpty());
    assertTrue(automaton.getAlphabet().isEmpty());
  }

  @Test
  public void testInvalidArguments() throws AutomatonException {
    final Automaton automaton = new AutomatonImpl();
    try {
      automaton.addState(-1, false, false);
      fail("Expected INVALID_STATE");
    } catch (AutomatonException expected) {
      assertEquals(Code.INVALID_STATE, expected.getCode());
    }
    try {
      automaton.addState(0, Optional.of("   "), false, false);
      fail("Expected INVALID_STATE_NAME");
    } catch (AutomatonException expected) {
      assertEquals(Code.INVALID_STATE_NAME, expected.getCode());
    }
    automaton.addState(0, false, false);
    try {
      automaton.addTransition(0, 0, (Optional<Character>) null);
      fail("Expected INVALID_TRANSITION");
    } catch (AutomatonException expected) {
      assertEquals(Code.INVALID_TRANSITION, expected.getCode());
    }
    assertTrue(automaton.getTransitions().isEmpty());
  }

  @Test
  public void testStateIdCeiling() throws AutomatonException {
    final Automaton automaton = new AutomatonImpl();
    for (int stateId : new int[] {State.maxStateId + 1, 1_500_000_000, Integer.MAX_VALUE}) {
      try {
        automaton.addState(stateId, true, true);
        fail("Expected INVALID_STATE for " + stateId);
      } catch (AutomatonException expected) {
        assertEquals(Code.INVALID_STATE, expected.getCode());
      }
    }
    assertTrue(automaton.getStates().isEmpty());

    // the largest allowed id works through closure, rendering and conversion
    automaton.addState(0, true, false);
    automaton.addState(State.maxStateId, false, true);
    automaton.addEpsilonTransition(0, State.maxStateId);
    automaton.addTransition(State.maxStateId, 0, 'a');
    try {
      automaton.addTransition(0, Integer.MAX_VALUE, 'a');
      fail("Expected INVALID_STATE");
    } catch (AutomatonException expected) {
      assertEquals(Code.INVALID_STATE, expected.getCode());
    }

    final StateSet closure = automaton.closure(0);
    assertEquals("{0," + State.maxStateId + "}", closure.toString());
    final Automaton dfa = automaton.toDFA();
    assertEquals(1, dfa.getStates().size());
    assertEquals("{0," + State.maxStateId + "}", dfa.getStartState().get().getName());
    assertTrue(dfa.accepts(""));
    assertTrue(dfa.accepts("aaa"));
  }

  @Test
  public void testAlphabetTracksTransitions() throws AutomatonException {
    final Automaton automaton = AutomatonBuilder.newBuilder().state(0, true, false).states(1, 2)
        .transition(0, 1, 'c').transition(1, 2, 'a').epsilon(2, 0).transition(2, 0, 'c').build();

    assertEquals(Arrays.asList('a', 'c'), Arrays.asList(automaton.getAlphabet().toArray()));
    assertEquals(4, automaton.getTransitions().size());
    try {
      automaton.getAlphabet().add('z');
      fail("Alphabet must not be modifiable");
    } catch (UnsupportedOperationException expected) {
    }
  }

  @Test
  public void testDuplicateTransitionIgnored() throws AutomatonException {
    final Automaton automaton = new AutomatonImpl();
    automaton.addState(0, true, false);
    automaton.addState(1, false, true);
    automaton.addTransition(0, 1, 'a');
    automaton.addTransition(0, 1, Optional.of('a'));
    automaton.addEpsilonTransition(0, 1);
    automaton.addTransition(0, 1, Optional.empty());

    assertEquals(2, automaton.getTransitions().size());
    assertEquals(1, automaton.getTransitions().stream().filter(Transition::isEpsilon).count());
  }

  @Test
  public void testStateCapacity() throws AutomatonException {
    final AutomatonConfiguration config =
        AutomatonConfigurationBuilder.newBuilder().maxStates(2).build();
    final Automaton automaton = new AutomatonImpl(config);
    automaton.addState(0, true, false);
    automaton.addState(1, false, true);
    // updating an existing state needs no extra room
    automaton.addState(1, false, false);
    try {
      automaton.addState(2, false, false);
      fail("Expected CAPACITY_EXCEEDED");
    } catch (AutomatonException expected) {
      assertEquals(Code.CAPACITY_EXCEEDED, expected.getCode());
    }
    assertEquals(2, automaton.getStates().size());
  }

  @Test
  public void testTransitionCapacity() throws AutomatonException {
    final AutomatonConfiguration config =
        AutomatonConfigurationBuilder.newBuilder().maxTransitions(1).build();
    final Automaton automaton = AutomatonBuilder.newBuilder().config(config)
        .state(0, true, false).state(1, false, true).transition(0, 1, 'a').build();
    // duplicates are a no-op, not a capacity failure
    automaton.addTransition(0, 1, 'a');
    try {
      automaton.addTransition(1, 0, 'b');
      fail("Expected CAPACITY_EXCEEDED");
    } catch (AutomatonException expected) {
      assertEquals(Code.CAPACITY_EXCEEDED, expected.getCode());
    }
    assertEquals(1, automaton.getTransitions().size());
    assertFalse(automaton.getAlphabet().contains('b'));
  }

  @Test
  public void testBuilderReportsFirstFailure() {
    try {
      AutomatonBuilder.newBuilder().state(0, true, false).transition(0, 1, 'a').state(1, false, true)
          .build();
      fail("Expected UNKNOWN_STATE");
    } catch (AutomatonException expected) {
      assertEquals(Code.UNKNOWN_STATE, expected.getCode());
    }
  }

  @Test
  public void testQueriesRejectUnknownStates() throws AutomatonException {
    final Automaton nfa = Automata.abbNfa();
    try {
      nfa.closure(11);
      fail("Expected UNKNOWN_STATE");
    } catch (AutomatonException expected) {
      assertEquals(Code.UNKNOWN_STATE, expected.getCode());
    }
    try {
      nfa.nextSet(StateSet.of(1, 99), 'a');
      fail("Expected UNKNOWN_STATE");
    } catch (AutomatonException expected) {
      assertEquals(Code.UNKNOWN_STATE, expected.getCode());
    }
  }

}
