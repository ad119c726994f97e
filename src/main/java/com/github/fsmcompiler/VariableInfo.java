package com.github.fsmcompiler;

import java.util.Objects;

import com.github.fsmcompiler.AutomatonException.Code;

/**
 * A declared automaton variable. The value is kept as the raw text default; it only gets a type
 * when the script generator classifies it.
 */
public final class VariableInfo {
  private final String name;
  private final String value;
  private final VarDataType type;

  public VariableInfo(final String name, final String value, final VarDataType type)
      throws AutomatonException {
    if (name == null || name.trim().isEmpty()) {
      throw new AutomatonException(Code.INVALID_VARIABLE);
    }
    this.name = Automaton.singleLineField(name);
    this.value = Automaton.singleLineField(value);
    this.type = type == null ? VarDataType.INT : type;
  }

  public String getName() {
    return name;
  }

  public String getValue() {
    return value;
  }

  public VarDataType getType() {
    return type;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof VariableInfo)) {
      return false;
    }
    VariableInfo other = (VariableInfo) o;
    return name.equals(other.name) && value.equals(other.value) && type == other.type;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, value, type);
  }

  @Override
  public String toString() {
    return "VariableInfo [name=" + name + ", value=" + value + ", type=" + type + "]";
  }

  /**
   * Declared type of a variable, written as {@code Int}, {@code Double} or {@code String} in the
   * text format.
   */
  public static enum VarDataType {
    INT("Int"),
    DOUBLE("Double"),
    STRING("String");

    private final String token;

    private VarDataType(final String token) {
      this.token = token;
    }

    public String getToken() {
      return token;
    }

    /**
     * Unrecognized tokens fall back to {@link #INT}.
     */
    public static VarDataType fromToken(final String token) {
      for (VarDataType type : values()) {
        if (type.token.equals(token)) {
          return type;
        }
      }
      return INT;
    }
  }
}
