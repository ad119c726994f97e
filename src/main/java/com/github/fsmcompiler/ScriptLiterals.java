package com.github.fsmcompiler;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * String transforms shared by the serializer and the script generator: identifier sanitization,
 * value literal classification and string literal quoting for the generated script.
 */
public final class ScriptLiterals {
  static final String EMPTY_NAME_PLACEHOLDER = "_empty_name_placeholder_";
  static final String RESERVED_SUFFIX = "_var";

  // longest operators first so that "<=" is not consumed as "<"
  private static final String[][] OPERATOR_WORDS = {{"<=", "le"}, {">=", "ge"}, {"==", "eq"},
      {"!=", "ne"}, {"<", "lt"}, {">", "gt"}};

  // keywords of the script language, the names every generated script binds or calls itself and
  // the parameters of generated functions
  private static final Set<String> RESERVED_WORDS =
      Collections.unmodifiableSet(new HashSet<>(Arrays.asList("False", "None", "True", "and",
          "as", "assert", "async", "await", "break", "class", "continue", "def", "del", "elif",
          "else", "except", "finally", "for", "from", "global", "if", "import", "in", "is",
          "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with",
          "yield", "FSM", "State", "Transition", "time", "logging", "fsm", "variables",
          "client_host", "client_port", "print", "always_true_condition", "KeyboardInterrupt",
          "Exception")));

  private static final Pattern INTEGER_PATTERN = Pattern.compile("[+-]?\\d+");
  private static final Pattern FLOAT_PATTERN =
      Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

  /**
   * Turns any text into a valid, non-empty identifier of the generated script. Distinct inputs
   * may map to the same identifier.
   */
  public static String sanitizeIdentifier(final String name) {
    if (name == null || name.isEmpty()) {
      return EMPTY_NAME_PLACEHOLDER;
    }
    String identifier = name.replace(' ', '_').replace('-', '_').replace('.', '_');
    for (String[] operatorWord : OPERATOR_WORDS) {
      identifier = identifier.replace(operatorWord[0], operatorWord[1]);
    }
    final StringBuilder builder = new StringBuilder(identifier.length() + 1);
    for (int i = 0; i < identifier.length(); i++) {
      final char c = identifier.charAt(i);
      if (isAsciiLetterOrDigit(c) || c == '_') {
        builder.append(c);
      }
    }
    if (builder.length() == 0) {
      return EMPTY_NAME_PLACEHOLDER;
    }
    if (Character.isDigit(builder.charAt(0))) {
      builder.insert(0, '_');
    }
    identifier = builder.toString();
    if (RESERVED_WORDS.contains(identifier)) {
      identifier = identifier + RESERVED_SUFFIX;
    }
    return identifier;
  }

  /**
   * Classifies a raw default value. Booleans win over numbers and numbers win over the string
   * fallback; a numeric form only counts when it spans the whole input.
   */
  public static Literal classify(final String raw) {
    if (raw == null || raw.isEmpty()) {
      return Literal.NONE;
    }
    final String lower = raw.toLowerCase(Locale.ROOT);
    if (lower.equals("true")) {
      return Literal.TRUE;
    }
    if (lower.equals("false")) {
      return Literal.FALSE;
    }
    if (INTEGER_PATTERN.matcher(raw).matches()) {
      // the script's integers are unbounded
      return new Literal(Literal.Kind.INTEGER, new BigInteger(raw).toString());
    }
    if (FLOAT_PATTERN.matcher(raw).matches()) {
      final double value = Double.parseDouble(raw);
      if (!Double.isInfinite(value)) {
        return new Literal(Literal.Kind.FLOAT, Double.toString(value));
      }
    }
    return new Literal(Literal.Kind.STRING, quote(raw));
  }

  /**
   * Wraps text in double quotes, escaping backslashes first and then quotes. Line breaks are
   * escaped as well since a string literal cannot span lines.
   */
  public static String quote(final String text) {
    final String escaped = text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n")
        .replace("\r", "\\r");
    return "\"" + escaped + "\"";
  }

  private static boolean isAsciiLetterOrDigit(final char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
  }

  private ScriptLiterals() {}
}
