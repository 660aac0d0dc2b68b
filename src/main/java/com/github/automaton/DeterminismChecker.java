package com.github.automaton;

import java.util.Map;

/**
 * Structural determinism check. Reachability is ignored: an unreachable epsilon edge or an
 * unreachable fork still makes the automaton nondeterministic.
 */
final class DeterminismChecker {
  private final AutomatonImpl automaton;

  DeterminismChecker(final AutomatonImpl automaton) {
    this.automaton = automaton;
  }

  boolean deterministic() {
    if (automaton.hasEpsilonTransitions()) {
      return false;
    }
    for (Map<Character, StateSet> edges : automaton.symbolEdges()) {
      for (StateSet targets : edges.values()) {
        if (targets.size() > 1) {
          return false;
        }
      }
    }
    return true;
  }

}
