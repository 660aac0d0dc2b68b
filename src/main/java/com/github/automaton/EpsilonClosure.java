package com.github.automaton;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Computes epsilon closures by a worklist traversal seeded with every input state at once. A state
 * is pushed only the first time it enters the result, which bounds the work by the number of
 * epsilon edges and makes epsilon cycles harmless.
 */
final class EpsilonClosure {
  private final AutomatonImpl automaton;

  EpsilonClosure(final AutomatonImpl automaton) {
    this.automaton = automaton;
  }

  /**
   * Returns a new set holding the seeds and everything epsilon-reachable from them. The seeds are
   * not modified.
   */
  StateSet closure(final StateSet seeds) {
    final StateSet closure = seeds.copy();
    final Deque<Integer> worklist = new ArrayDeque<>();
    seeds.stream().forEach(worklist::push);

    while (!worklist.isEmpty()) {
      final StateSet targets = automaton.epsilonTargets(worklist.pop());
      if (targets == null) {
        continue;
      }
      targets.stream().forEach(target -> {
        if (closure.add(target)) {
          worklist.push(target);
        }
      });
    }
    return closure;
  }

}
