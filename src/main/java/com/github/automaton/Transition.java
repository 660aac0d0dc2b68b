package com.github.automaton;

import java.util.Objects;
import java.util.Optional;

import com.github.automaton.AutomatonException.Code;

/**
 * An ordered (from, symbol, to) triple. An empty symbol marks an epsilon transition, which is
 * taken without consuming input. Two transitions are equal when all three parts are equal.
 */
public final class Transition {
  private final String transitionId;
  private final int fromState;
  private final Optional<Character> symbol;
  private final int toState;

  public Transition(final int fromState, final Optional<Character> symbol, final int toState)
      throws AutomatonException {
    if (symbol == null) {
      throw new AutomatonException(Code.INVALID_TRANSITION);
    }
    for (int stateId : new int[] {fromState, toState}) {
      if (stateId < 0 || stateId > State.maxStateId) {
        throw new AutomatonException(Code.INVALID_STATE,
            "State id must be between 0 and " + State.maxStateId + ": " + stateId);
      }
    }
    this.fromState = fromState;
    this.symbol = symbol;
    this.toState = toState;
    this.transitionId = transitionId(fromState, symbol, toState);
  }

  static String transitionId(final int fromState, final Optional<Character> symbol,
      final int toState) {
    return new StringBuilder().append(fromState).append("--")
        .append(symbol.map(String::valueOf).orElse("ε")).append("->").append(toState)
        .toString();
  }

  public String getTransitionId() {
    return transitionId;
  }

  public int getFromState() {
    return fromState;
  }

  public Optional<Character> getSymbol() {
    return symbol;
  }

  public int getToState() {
    return toState;
  }

  public boolean isEpsilon() {
    return !symbol.isPresent();
  }

  @Override
  public int hashCode() {
    return Objects.hash(fromState, symbol, toState);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Transition)) {
      return false;
    }
    Transition other = (Transition) obj;
    return fromState == other.fromState && toState == other.toState
        && symbol.equals(other.symbol);
  }

  @Override
  public String toString() {
    return "Transition [" + transitionId + "]";
  }
}
