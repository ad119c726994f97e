package com.github.fsmcompiler;

import java.util.Objects;

/**
 * A value rendered as a literal of the generated script's language, together with the kind of
 * literal it was classified as.
 */
public final class Literal {
  static final Literal NONE = new Literal(Kind.NONE, "None");
  static final Literal TRUE = new Literal(Kind.BOOLEAN, "True");
  static final Literal FALSE = new Literal(Kind.BOOLEAN, "False");

  private final Kind kind;
  private final String text;

  Literal(final Kind kind, final String text) {
    this.kind = kind;
    this.text = text;
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * The literal exactly as it appears in generated code.
   */
  public String getText() {
    return text;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Literal)) {
      return false;
    }
    Literal other = (Literal) o;
    return kind == other.kind && text.equals(other.text);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, text);
  }

  @Override
  public String toString() {
    return text;
  }

  public static enum Kind {
    // empty raw value
    NONE,
    BOOLEAN,
    INTEGER,
    FLOAT,
    STRING;
  }
}
