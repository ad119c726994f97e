package com.github.fsmcompiler;

/**
 * Unified single exception that's thrown by the automaton model, its file format and the script
 * generator. The code enum encapsulates the various error conditions. Problems found while parsing
 * the text format are not reported through this exception, they are collected as
 * {@link ParseDiagnostic}s instead.
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

  public AutomatonException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    FILE_READ_FAILURE("Failed to open or read the automaton specification file"),
    // 2.
    FILE_WRITE_FAILURE("Failed to open or write the output file"),
    // 3.
    INVALID_STATE_NAME("State name cannot be null or blank"),
    // 4.
    INVALID_TRANSITION("Transition endpoints cannot be null or blank"),
    // 5.
    INVALID_DELAY("Transition delay cannot be negative"),
    // 6.
    INVALID_VARIABLE("Variable name cannot be null or blank"),
    // 7.
    INVALID_COMPILER_CONFIG("Compiler configuration is invalid"),
    // 8.
    UNKNOWN_FAILURE("Automaton compiler failed. Check exception stacktrace for more details");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
