package com.github.automaton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The outcome of a subset construction: the DFA itself and, for every DFA state id, the subset of
 * NFA states it stands for. DFA state ids run from 0 to {@link #size()} - 1, with 0 the start
 * state. A DFA built from an automaton without a start state is empty.
 */
public final class SubsetConstruction {
  private final Automaton dfa;
  private final List<StateSet> subsets;
  private final int expandedSubsets;

  SubsetConstruction(final Automaton dfa, final List<StateSet> subsets,
      final int expandedSubsets) {
    this.dfa = dfa;
    this.subsets = Collections.unmodifiableList(new ArrayList<>(subsets));
    this.expandedSubsets = expandedSubsets;
  }

  public Automaton getDfa() {
    return dfa;
  }

  /**
   * The NFA states behind the given DFA state.
   * 
   * @throws IndexOutOfBoundsException if the id is not a state of the DFA
   */
  public StateSet getSubset(final int dfaStateId) {
    return subsets.get(dfaStateId).copy();
  }

  public int size() {
    return subsets.size();
  }

  public int getExpandedSubsets() {
    return expandedSubsets;
  }

  @Override
  public String toString() {
    return "SubsetConstruction [dfa=" + dfa.getId() + ", subsets=" + subsets
        + ", expandedSubsets=" + expandedSubsets + "]";
  }
}
