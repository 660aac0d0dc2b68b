package com.github.automaton;

/**
 * The next-state function. Results are always closed under epsilon transitions, so callers never
 * re-close them.
 */
final class TransitionFunction {
  private final AutomatonImpl automaton;
  private final EpsilonClosure closureEngine;

  TransitionFunction(final AutomatonImpl automaton, final EpsilonClosure closureEngine) {
    this.automaton = automaton;
    this.closureEngine = closureEngine;
  }

  /**
   * Epsilon-close the sources, follow every edge on the symbol, then epsilon-close the targets.
   */
  StateSet next(final StateSet sources, final char symbol) {
    return step(closureEngine.closure(sources), symbol);
  }

  /**
   * Same as {@link #next(StateSet, char)} for sources that are already epsilon-closed, which is
   * always the case for the current set of a simulation or a subset under expansion.
   */
  StateSet step(final StateSet closedSources, final char symbol) {
    final StateSet targets = new StateSet();
    closedSources.stream().forEach(source -> {
      final StateSet edges = automaton.symbolTargets(source, symbol);
      if (edges != null) {
        targets.addAll(edges);
      }
    });
    if (targets.isEmpty()) {
      return targets;
    }
    return closureEngine.closure(targets);
  }

}
