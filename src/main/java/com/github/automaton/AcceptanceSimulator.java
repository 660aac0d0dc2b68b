package com.github.automaton;

import java.util.Objects;
import java.util.Optional;

/**
 * Runs an input through an automaton by tracking the set of states it could be in.
 */
final class AcceptanceSimulator {
  private final AutomatonImpl automaton;
  private final EpsilonClosure closureEngine;
  private final TransitionFunction transitionFunction;

  AcceptanceSimulator(final AutomatonImpl automaton, final EpsilonClosure closureEngine,
      final TransitionFunction transitionFunction) {
    this.automaton = automaton;
    this.closureEngine = closureEngine;
    this.transitionFunction = transitionFunction;
  }

  boolean accepts(final CharSequence input) {
    Objects.requireNonNull(input, "Input cannot be null");
    final Optional<State> startState = automaton.getStartState();
    if (!startState.isPresent()) {
      AutomatonImpl.logDebug(automaton.getId(), "No start state, rejecting input");
      return false;
    }

    StateSet current = closureEngine.closure(StateSet.of(startState.get().getId()));
    for (int i = 0; i < input.length(); i++) {
      current = transitionFunction.step(current, input.charAt(i));
      if (current.isEmpty()) {
        // dead: nothing left can lead to acceptance
        return false;
      }
    }
    return automaton.containsAccepting(current);
  }

}
