package com.github.automaton;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * NFA to DFA conversion by subset construction, run as a breadth first search over the subsets
 * reachable from the epsilon closure of the start state.
 * 
 * Each discovered subset is interned by value in a hash map, so two different paths that reach the
 * same subset share one DFA state and every subset is expanded exactly once. DFA ids are handed out
 * in discovery order starting at 0 (the start subset), and symbols are tried in ascending order, so
 * the same input always yields the same DFA.
 */
final class SubsetConstructor {
  private final AutomatonImpl nfa;
  private final EpsilonClosure closureEngine;
  private final TransitionFunction transitionFunction;

  // K=subset of nfa states, V=dfa state id
  private final Map<StateSet, Integer> interned = new HashMap<>();
  // dfa state id -> subset
  private final List<StateSet> subsets = new ArrayList<>();
  private final Deque<StateSet> unexpanded = new ArrayDeque<>();

  private AutomatonImpl dfa;

  SubsetConstructor(final AutomatonImpl nfa, final EpsilonClosure closureEngine,
      final TransitionFunction transitionFunction) {
    this.nfa = nfa;
    this.closureEngine = closureEngine;
    this.transitionFunction = transitionFunction;
  }

  SubsetConstruction determinize() throws AutomatonException {
    final long startMillis = System.currentTimeMillis();
    dfa = new AutomatonImpl(nfa.getConfiguration());

    final Optional<State> startState = nfa.getStartState();
    if (!startState.isPresent()) {
      AutomatonImpl.logWarning(nfa.getId(),
          "Converting an automaton without a start state, the resulting DFA accepts nothing");
      return new SubsetConstruction(dfa, subsets, 0);
    }

    intern(closureEngine.closure(StateSet.of(startState.get().getId())));

    int expanded = 0;
    while (!unexpanded.isEmpty()) {
      final StateSet current = unexpanded.poll();
      final int currentId = interned.get(current);
      for (char symbol : nfa.getAlphabet()) {
        final StateSet target = transitionFunction.step(current, symbol);
        if (target.isEmpty()) {
          continue;
        }
        Integer targetId = interned.get(target);
        if (targetId == null) {
          targetId = intern(target);
        }
        dfa.addTransition(currentId, targetId, symbol);
      }
      expanded++;
    }

    AutomatonImpl.logInfo(nfa.getId(),
        "Converted {} nfa states into {} dfa states (dfa {}) in {} millis",
        nfa.getStates().size(), subsets.size(), dfa.getId(),
        System.currentTimeMillis() - startMillis);
    return new SubsetConstruction(dfa, subsets, expanded);
  }

  private int intern(final StateSet subset) throws AutomatonException {
    final int dfaStateId = subsets.size();
    // goes through the regular construction path so capacity limits apply to the dfa too
    dfa.addState(dfaStateId, Optional.of(subset.toString()), dfaStateId == 0,
        nfa.containsAccepting(subset));
    subsets.add(subset);
    interned.put(subset, dfaStateId);
    unexpanded.add(subset);
    AutomatonImpl.logDebug(nfa.getId(), "Discovered subset {} as dfa state {}", subset,
        dfaStateId);
    return dfaStateId;
  }

}
