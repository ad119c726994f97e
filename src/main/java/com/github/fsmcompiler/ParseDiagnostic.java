package com.github.fsmcompiler;

/**
 * One problem reported while parsing the text format. Parsing never stops on a diagnostic.
 */
public final class ParseDiagnostic {
  private final int lineNumber;
  private final Category category;
  private final String message;
  private final String line;

  ParseDiagnostic(final int lineNumber, final Category category, final String message,
      final String line) {
    this.lineNumber = lineNumber;
    this.category = category;
    this.message = message;
    this.line = line;
  }

  /**
   * 1-based line number, or the number of the last line for end-of-input problems.
   */
  public int getLineNumber() {
    return lineNumber;
  }

  public Category getCategory() {
    return category;
  }

  public String getMessage() {
    return message;
  }

  /**
   * The offending line after comment stripping, empty for end-of-input problems.
   */
  public String getLine() {
    return line;
  }

  @Override
  public String toString() {
    return "line " + lineNumber + " [" + category + "] " + message
        + (line.isEmpty() ? "" : ": " + line);
  }

  public static enum Category {
    // the line did not match the keyword expected at this point and was discarded
    STRUCTURAL,
    // a field inside an accepted construct could not be parsed; the construct was still committed
    FIELD;
  }
}
