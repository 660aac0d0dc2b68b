package com.github.automaton;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automaton.AutomatonException.Code;

/**
 * Default {@link Automaton}. Besides the plain state and transition collections it keeps an
 * adjacency index keyed by source state, split into epsilon edges and symbol edges, so closure and
 * next-state computations never scan the whole transition set.
 * 
 * Every mutating call validates its arguments and capacity before it writes anything.
 */
public final class AutomatonImpl implements Automaton {
  private static final Logger logger = LogManager.getLogger(AutomatonImpl.class.getSimpleName());

  private final String automatonId = UUID.randomUUID().toString();

  private final AutomatonConfiguration config;

  // K=state.id, V=state. Ordered so that getStates() is stable.
  private final SortedMap<Integer, State> states = new TreeMap<>();
  private final Set<Transition> transitions = new LinkedHashSet<>();
  private final SortedSet<Character> alphabet = new TreeSet<>();
  private final StateSet acceptingStates = new StateSet();
  private State startState;

  // K=fromState.id, V=targets of epsilon edges
  private final Map<Integer, StateSet> epsilonEdges = new HashMap<>();
  // K=fromState.id, V=(symbol -> targets)
  private final Map<Integer, Map<Character, StateSet>> symbolEdges = new HashMap<>();

  private final EpsilonClosure closureEngine = new EpsilonClosure(this);
  private final TransitionFunction transitionFunction =
      new TransitionFunction(this, closureEngine);
  private final AcceptanceSimulator simulator =
      new AcceptanceSimulator(this, closureEngine, transitionFunction);
  private final DeterminismChecker determinismChecker = new DeterminismChecker(this);

  public AutomatonImpl() {
    this(AutomatonConfiguration.defaults());
  }

  public AutomatonImpl(final AutomatonConfiguration config) {
    this.config = Objects.requireNonNull(config, "AutomatonConfiguration cannot be null");
    logDebug(automatonId, "Created automaton with {}", config);
  }

  @Override
  public void addState(final int stateId, final boolean isStart, final boolean isAccepting)
      throws AutomatonException {
    addState(stateId, Optional.empty(), isStart, isAccepting);
  }

  @Override
  public void addState(final int stateId, final Optional<String> name, final boolean isStart,
      final boolean isAccepting) throws AutomatonException {
    final State existing = states.get(stateId);
    Optional<String> effectiveName = name;
    if ((name == null || !name.isPresent()) && existing != null) {
      effectiveName = Optional.of(existing.getName());
    }
    final State state = new State(stateId, effectiveName, isStart, isAccepting);

    if (existing == null && config.statesBounded() && states.size() >= config.getMaxStates()) {
      throw new AutomatonException(Code.CAPACITY_EXCEEDED, String.format(
          "Cannot add state %d, automaton is at its capacity of %d states", stateId,
          config.getMaxStates()));
    }

    State demoted = null;
    if (isStart && startState != null && startState.getId() != stateId) {
      if (config.getStartStatePolicy() == StartStatePolicy.REJECT) {
        throw new AutomatonException(Code.DUPLICATE_START, String.format(
            "Cannot mark state %d as start, state %d already is", stateId, startState.getId()));
      }
      demoted = startState.withStart(false);
    }

    // all checks passed, now write
    if (demoted != null) {
      states.put(demoted.getId(), demoted);
      logDebug(automatonId, "Replaced start state {} with {}", demoted.getId(), stateId);
    }
    states.put(stateId, state);
    if (isStart) {
      startState = state;
    } else if (startState != null && startState.getId() == stateId) {
      startState = null;
    }
    if (isAccepting) {
      acceptingStates.add(stateId);
    } else {
      acceptingStates.remove(stateId);
    }
    logDebug(automatonId, existing == null ? "Added {}" : "Updated {}", state);
  }

  @Override
  public void addTransition(final int fromState, final int toState, final char symbol)
      throws AutomatonException {
    addTransition(fromState, toState, Optional.of(symbol));
  }

  @Override
  public void addEpsilonTransition(final int fromState, final int toState)
      throws AutomatonException {
    addTransition(fromState, toState, Optional.empty());
  }

  @Override
  public void addTransition(final int fromState, final int toState,
      final Optional<Character> symbol) throws AutomatonException {
    final Transition transition = new Transition(fromState, symbol, toState);
    requireState(fromState);
    requireState(toState);
    if (transitions.contains(transition)) {
      logDebug(automatonId, "Ignored duplicate {}", transition);
      return;
    }
    if (config.transitionsBounded() && transitions.size() >= config.getMaxTransitions()) {
      throw new AutomatonException(Code.CAPACITY_EXCEEDED, String.format(
          "Cannot add %s, automaton is at its capacity of %d transitions",
          transition.getTransitionId(), config.getMaxTransitions()));
    }

    transitions.add(transition);
    if (transition.isEpsilon()) {
      epsilonEdges.computeIfAbsent(fromState, k -> new StateSet()).add(toState);
    } else {
      final char c = symbol.get();
      symbolEdges.computeIfAbsent(fromState, k -> new HashMap<>())
          .computeIfAbsent(c, k -> new StateSet()).add(toState);
      alphabet.add(c);
    }
    logDebug(automatonId, "Added {}", transition);
  }

  @Override
  public boolean accepts(final CharSequence input) {
    return simulator.accepts(input);
  }

  @Override
  public boolean deterministic() {
    return determinismChecker.deterministic();
  }

  @Override
  public StateSet closure(final int stateId) throws AutomatonException {
    requireState(stateId);
    return closureEngine.closure(StateSet.of(stateId));
  }

  @Override
  public StateSet closureSet(final StateSet stateIds) throws AutomatonException {
    requireStates(stateIds);
    return closureEngine.closure(stateIds);
  }

  @Override
  public StateSet next(final int stateId, final char symbol) throws AutomatonException {
    requireState(stateId);
    return transitionFunction.next(StateSet.of(stateId), symbol);
  }

  @Override
  public StateSet nextSet(final StateSet stateIds, final char symbol) throws AutomatonException {
    requireStates(stateIds);
    return transitionFunction.next(stateIds, symbol);
  }

  @Override
  public Automaton toDFA() throws AutomatonException {
    return determinize().getDfa();
  }

  @Override
  public SubsetConstruction determinize() throws AutomatonException {
    return new SubsetConstructor(this, closureEngine, transitionFunction).determinize();
  }

  @Override
  public String getId() {
    return automatonId;
  }

  @Override
  public Optional<State> getStartState() {
    return Optional.ofNullable(startState);
  }

  @Override
  public Optional<State> findState(final int stateId) {
    return Optional.ofNullable(states.get(stateId));
  }

  @Override
  public Collection<State> getStates() {
    return Collections.unmodifiableCollection(states.values());
  }

  @Override
  public Set<Transition> getTransitions() {
    return Collections.unmodifiableSet(transitions);
  }

  @Override
  public SortedSet<Character> getAlphabet() {
    return Collections.unmodifiableSortedSet(alphabet);
  }

  @Override
  public AutomatonConfiguration getConfiguration() {
    return config;
  }

  ///// Index lookups for the engine classes. Returned sets must not be modified. /////
  StateSet epsilonTargets(final int stateId) {
    return epsilonEdges.get(stateId);
  }

  StateSet symbolTargets(final int stateId, final char symbol) {
    final Map<Character, StateSet> edges = symbolEdges.get(stateId);
    return edges == null ? null : edges.get(symbol);
  }

  boolean hasEpsilonTransitions() {
    return !epsilonEdges.isEmpty();
  }

  Collection<Map<Character, StateSet>> symbolEdges() {
    return symbolEdges.values();
  }

  boolean containsAccepting(final StateSet stateIds) {
    return stateIds.containsAny(acceptingStates);
  }

  private void requireState(final int stateId) throws AutomatonException {
    if (!states.containsKey(stateId)) {
      throw new AutomatonException(Code.UNKNOWN_STATE,
          "State " + stateId + " was never added to automaton " + automatonId);
    }
  }

  private void requireStates(final StateSet stateIds) throws AutomatonException {
    Objects.requireNonNull(stateIds, "StateSet cannot be null");
    final int[] ids = stateIds.stream().toArray();
    for (int stateId : ids) {
      requireState(stateId);
    }
  }

  @Override
  public String toString() {
    return "AutomatonImpl [automatonId=" + automatonId + ", states=" + states.size()
        + ", transitions=" + transitions.size() + ", alphabet=" + alphabet + ", startState="
        + (startState == null ? "none" : startState.getName()) + "]";
  }

  // messages use log4j {} placeholders, the id fills the first one
  static void logInfo(final String automatonId, final String message, final Object... params) {
    logger.info("[a:{}] " + message, prepend(automatonId, params));
  }

  static void logWarning(final String automatonId, final String message,
      final Object... params) {
    logger.warn("[a:{}] " + message, prepend(automatonId, params));
  }

  static void logDebug(final String automatonId, final String message, final Object... params) {
    if (logger.isDebugEnabled()) {
      logger.debug("[a:{}] " + message, prepend(automatonId, params));
    }
  }

  private static Object[] prepend(final String automatonId, final Object[] params) {
    final Object[] all = new Object[params.length + 1];
    all[0] = automatonId;
    System.arraycopy(params, 0, all, 1, params.length);
    return all;
  }

}
