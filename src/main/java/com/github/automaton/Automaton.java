package com.github.automaton;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;

/**
 * A finite automaton over a character alphabet, possibly nondeterministic and possibly carrying
 * epsilon transitions.
 * 
 * Notes for users:<br>
 * 1. an automaton is built incrementally with {@link #addState} and {@link #addTransition} and is
 * then treated as read-only by every query and by {@link #toDFA()}<br>
 * 
 * 2. instances do no locking. Do not mutate an automaton from more than one thread; once it is
 * fully built, queries may run from any thread since they never write<br>
 * 
 * 3. every {@link StateSet} returned by a query is a fresh copy owned by the caller and is already
 * closed under epsilon transitions<br>
 * 
 * 4. {@link #toDFA()} never touches this automaton. It returns a new, independent automaton that
 * can be queried and converted the same way<br>
 */
public interface Automaton {

  ///// Construction API /////
  /**
   * Add a state or, if the id is already present, replace its flags. What happens when a second
   * state is marked as start depends on the configured {@link StartStatePolicy}.
   */
  void addState(final int stateId, final boolean isStart, final boolean isAccepting)
      throws AutomatonException;

  /**
   * Same as {@link #addState(int, boolean, boolean)} with a human readable name. An empty name
   * keeps the current name of an existing state, or the decimal id for a new one.
   */
  void addState(final int stateId, final Optional<String> name, final boolean isStart,
      final boolean isAccepting) throws AutomatonException;

  /**
   * Add a transition consuming the given symbol. Both endpoints must have been added already.
   */
  void addTransition(final int fromState, final int toState, final char symbol)
      throws AutomatonException;

  /**
   * Add an epsilon transition. Both endpoints must have been added already.
   */
  void addEpsilonTransition(final int fromState, final int toState) throws AutomatonException;

  /**
   * Add a transition where an empty symbol denotes epsilon.
   */
  void addTransition(final int fromState, final int toState, final Optional<Character> symbol)
      throws AutomatonException;


  ///// Query API /////
  /**
   * Returns true iff the input drives the automaton from its start state into a set of states that
   * contains an accepting state. An automaton without a start state accepts nothing.
   */
  boolean accepts(final CharSequence input);

  /**
   * Returns true iff there are no epsilon transitions and no (state, symbol) pair has more than one
   * target. Unreachable states count.
   */
  boolean deterministic();

  /**
   * The states reachable from the given state using only epsilon transitions, itself included.
   */
  StateSet closure(final int stateId) throws AutomatonException;

  /**
   * The union of {@link #closure(int)} over all the given states.
   */
  StateSet closureSet(final StateSet stateIds) throws AutomatonException;

  /**
   * The epsilon-closed set of states reachable from the closure of the given state by one
   * transition on the given symbol. Empty if nothing matches.
   */
  StateSet next(final int stateId, final char symbol) throws AutomatonException;

  /**
   * The union of {@link #next(int, char)} over all the given states.
   */
  StateSet nextSet(final StateSet stateIds, final char symbol) throws AutomatonException;


  ///// Transform API /////
  /**
   * Convert this automaton into an equivalent deterministic one via subset construction.
   */
  Automaton toDFA() throws AutomatonException;

  /**
   * Same as {@link #toDFA()} but also reports which subset of this automaton's states each DFA
   * state stands for.
   */
  SubsetConstruction determinize() throws AutomatonException;


  ///// Accessors /////
  String getId();

  Optional<State> getStartState();

  Optional<State> findState(final int stateId);

  /**
   * All states ordered by id.
   */
  Collection<State> getStates();

  /**
   * All transitions in insertion order.
   */
  Set<Transition> getTransitions();

  /**
   * The distinct non-epsilon symbols used by transitions, ascending.
   */
  SortedSet<Character> getAlphabet();

  AutomatonConfiguration getConfiguration();

  /**
   * A simple builder to let users use fluent APIs to build automata. Recorded states and
   * transitions are replayed in order by {@link #build()}, which reports the first failure.
   */
  public final static class AutomatonBuilder {
    private AutomatonConfiguration config = AutomatonConfiguration.defaults();
    private final List<Step> steps = new ArrayList<>();

    public static AutomatonBuilder newBuilder() {
      return new AutomatonBuilder();
    }

    public AutomatonBuilder config(final AutomatonConfiguration config) {
      this.config = config;
      return this;
    }

    public AutomatonBuilder state(final int stateId, final boolean isStart,
        final boolean isAccepting) {
      steps.add(automaton -> automaton.addState(stateId, isStart, isAccepting));
      return this;
    }

    public AutomatonBuilder states(final int... stateIds) {
      for (int stateId : stateIds) {
        state(stateId, false, false);
      }
      return this;
    }

    public AutomatonBuilder transition(final int fromState, final int toState, final char symbol) {
      steps.add(automaton -> automaton.addTransition(fromState, toState, symbol));
      return this;
    }

    public AutomatonBuilder epsilon(final int fromState, final int toState) {
      steps.add(automaton -> automaton.addEpsilonTransition(fromState, toState));
      return this;
    }

    public Automaton build() throws AutomatonException {
      final Automaton automaton = new AutomatonImpl(config);
      for (Step step : steps) {
        step.apply(automaton);
      }
      return automaton;
    }

    private AutomatonBuilder() {}

    private interface Step {
      void apply(Automaton automaton) throws AutomatonException;
    }
  }

}
