package com.github.automaton;

import java.util.BitSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * A set of state ids, backed by a {@link BitSet} since ids are small non-negative integers, at most
 * {@code State.maxStateId}. This
 * gives constant time membership and insertion, and value based {@link #equals(Object)} and
 * {@link #hashCode()} so a StateSet can be used directly as a hash key while interning subsets.
 * 
 * StateSets are transient working values: they are built up during a closure or a conversion and
 * are never stored as part of an automaton's own structure.
 */
public final class StateSet {
  private final BitSet members;

  public StateSet() {
    this(new BitSet());
  }

  private StateSet(final BitSet members) {
    this.members = members;
  }

  public static StateSet of(final int... stateIds) {
    final StateSet set = new StateSet();
    for (int stateId : stateIds) {
      set.add(stateId);
    }
    return set;
  }

  public boolean contains(final int stateId) {
    return stateId >= 0 && stateId <= State.maxStateId && members.get(stateId);
  }

  /**
   * Returns true iff the id was not already present.
   */
  public boolean add(final int stateId) {
    if (stateId < 0 || stateId > State.maxStateId) {
      throw new IllegalArgumentException(
          "State id must be between 0 and " + State.maxStateId + ": " + stateId);
    }
    if (members.get(stateId)) {
      return false;
    }
    members.set(stateId);
    return true;
  }

  void remove(final int stateId) {
    if (stateId >= 0) {
      members.clear(stateId);
    }
  }

  void addAll(final StateSet other) {
    members.or(other.members);
  }

  public StateSet union(final StateSet other) {
    final StateSet result = copy();
    result.addAll(other);
    return result;
  }

  public StateSet copy() {
    return new StateSet((BitSet) members.clone());
  }

  public int size() {
    return members.cardinality();
  }

  public boolean isEmpty() {
    return members.isEmpty();
  }

  /**
   * Member ids in ascending order.
   */
  public IntStream stream() {
    return members.stream();
  }

  public boolean containsAny(final StateSet other) {
    return members.intersects(other.members);
  }

  @Override
  public int hashCode() {
    return members.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof StateSet)) {
      return false;
    }
    return members.equals(((StateSet) obj).members);
  }

  /**
   * Renders the members sorted ascending, comma separated, inside braces, eg. {1,2,4,6,7}.
   */
  @Override
  public String toString() {
    return members.stream().mapToObj(Integer::toString)
        .collect(Collectors.joining(",", "{", "}"));
  }
}
