package com.github.automaton;

/**
 * This class encapsulates all the configuration parameters for an {@link Automaton}. Use the
 * {@code AutomatonConfigurationBuilder} to build it.
 * 
 * Notes:<br>
 * 1. If no start state policy is set, {@link StartStatePolicy#REJECT} is used.<br>
 * 2. A capacity of 0 means unbounded. When a capacity is set, every addState() or addTransition()
 * that would go past it fails with {@code CAPACITY_EXCEEDED} instead of truncating.<br>
 * 3. A DFA built by subset construction inherits the whole configuration of its source automaton.
 * maxStates bounds the number of subsets a conversion may discover and maxTransitions bounds the
 * DFA's transitions, which can outnumber the source's, so a conversion may fail with
 * {@code CAPACITY_EXCEEDED} on either limit even when the source fits both.<br>
 */
public final class AutomatonConfiguration {
  private static final AutomatonConfiguration defaults =
      new AutomatonConfiguration(StartStatePolicy.REJECT, 0, 0);

  private final StartStatePolicy startStatePolicy;
  private final int maxStates;
  private final int maxTransitions;

  public static AutomatonConfiguration defaults() {
    return defaults;
  }

  public StartStatePolicy getStartStatePolicy() {
    return startStatePolicy;
  }

  public int getMaxStates() {
    return maxStates;
  }

  public int getMaxTransitions() {
    return maxTransitions;
  }

  boolean statesBounded() {
    return maxStates > 0;
  }

  boolean transitionsBounded() {
    return maxTransitions > 0;
  }

  public final static class AutomatonConfigurationBuilder {
    private StartStatePolicy startStatePolicy = StartStatePolicy.REJECT;
    private int maxStates;
    private int maxTransitions;

    public static AutomatonConfigurationBuilder newBuilder() {
      return new AutomatonConfigurationBuilder();
    }

    public AutomatonConfigurationBuilder startStatePolicy(final StartStatePolicy startStatePolicy) {
      this.startStatePolicy = startStatePolicy;
      return this;
    }

    public AutomatonConfigurationBuilder maxStates(final int maxStates) {
      this.maxStates = maxStates;
      return this;
    }

    public AutomatonConfigurationBuilder maxTransitions(final int maxTransitions) {
      this.maxTransitions = maxTransitions;
      return this;
    }

    public AutomatonConfiguration build() throws AutomatonException {
      final AutomatonConfiguration config =
          new AutomatonConfiguration(startStatePolicy, maxStates, maxTransitions);
      config.validate();
      return config;
    }

    private AutomatonConfigurationBuilder() {}
  }

  private void validate() throws AutomatonException {
    StringBuilder messages = new StringBuilder();
    if (startStatePolicy == null) {
      messages.append("StartStatePolicy cannot be null. ");
    }
    if (maxStates < 0) {
      messages.append("maxStates cannot be negative. ");
    }
    if (maxTransitions < 0) {
      messages.append("maxTransitions cannot be negative. ");
    }
    if (messages.length() > 0) {
      throw new AutomatonException(AutomatonException.Code.INVALID_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "AutomatonConfiguration [startStatePolicy=" + startStatePolicy + ", maxStates="
        + maxStates + ", maxTransitions=" + maxTransitions + "]";
  }

  private AutomatonConfiguration(final StartStatePolicy startStatePolicy, final int maxStates,
      final int maxTransitions) {
    this.startStatePolicy = startStatePolicy;
    this.maxStates = maxStates;
    this.maxTransitions = maxTransitions;
  }

}
