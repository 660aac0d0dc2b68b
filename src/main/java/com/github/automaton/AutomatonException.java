package com.github.automaton;

/**
 * Unified single exception that's thrown by the automaton engine. The code enum encapsulates the
 * various error conditions so callers can branch on {@link #getCode()} rather than on message text.
 * Construction errors are raised before anything is written, so the automaton that threw is left
 * exactly as it was before the failed call.
 */
public final class AutomatonException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public AutomatonException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public AutomatonException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    UNKNOWN_STATE("Referenced state was never added to the automaton"),
    // 2.
    DUPLICATE_START("Automaton already has a different start state"),
    // 3.
    CAPACITY_EXCEEDED("Automaton reached its configured state or transition capacity"),
    // 4.
    INVALID_STATE("State id must be between 0 and " + State.maxStateId),
    // 5.
    INVALID_STATE_NAME("State name cannot be null or blank"),
    // 6.
    INVALID_TRANSITION("Transition symbol holder cannot be null"),
    // 7.
    INVALID_CONFIG("Automaton configuration is invalid");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
