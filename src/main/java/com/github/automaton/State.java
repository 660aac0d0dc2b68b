package com.github.automaton;

import java.util.Optional;

import com.github.automaton.AutomatonException.Code;

/**
 * This object represents immutable metadata about a state: its id, an optional name and the
 * start/accepting flags. Re-adding a state to an automaton replaces the instance rather than
 * mutating it.
 */
public final class State {
  // ids index a BitSet in StateSet, so they are kept small
  final static int maxStateId = 65_535;

  private final int id;
  private final String name; // optional
  private final boolean start;
  private final boolean accepting;

  /**
   * State name is optional. When absent, the decimal id doubles as the name.
   */
  public State(final int id, final Optional<String> name, final boolean start,
      final boolean accepting) throws AutomatonException {
    if (id < 0 || id > maxStateId) {
      throw new AutomatonException(Code.INVALID_STATE,
          "State id must be between 0 and " + maxStateId + ": " + id);
    }
    if (name != null && name.isPresent()) {
      if (name.get().trim().isEmpty()) {
        throw new AutomatonException(Code.INVALID_STATE_NAME);
      }
      this.name = name.get().trim();
    } else {
      this.name = Integer.toString(id);
    }
    this.id = id;
    this.start = start;
    this.accepting = accepting;
  }

  public int getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public boolean isStart() {
    return start;
  }

  public boolean isAccepting() {
    return accepting;
  }

  State withStart(final boolean start) {
    if (start == this.start) {
      return this;
    }
    try {
      return new State(id, Optional.of(name), start, accepting);
    } catch (AutomatonException impossible) {
      // id and name were already validated when this instance was made
      throw new IllegalStateException(impossible);
    }
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + id;
    result = prime * result + ((name == null) ? 0 : name.hashCode());
    result = prime * result + (start ? 1231 : 1237);
    result = prime * result + (accepting ? 1231 : 1237);
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    State other = (State) obj;
    if (id != other.id) {
      return false;
    }
    if (name == null) {
      if (other.name != null) {
        return false;
      }
    } else if (!name.equals(other.name)) {
      return false;
    }
    return start == other.start && accepting == other.accepting;
  }

  @Override
  public String toString() {
    return "State [id=" + id + ", name=" + name + ", start=" + start + ", accepting=" + accepting
        + "]";
  }
}
