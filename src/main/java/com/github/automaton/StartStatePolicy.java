package com.github.automaton;

/**
 * What an automaton does when a state is marked as start while a different state already is.
 */
public enum StartStatePolicy {
  // fail the addState() call with DUPLICATE_START and leave the automaton untouched.
  REJECT,
  // demote the previous start state and promote the new one.
  REPLACE;
}
