package com.github.fsmcompiler;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmcompiler.ParseDiagnostic.Category;
import com.github.fsmcompiler.VariableInfo.VarDataType;

/**
 * Reads the line-oriented {@code .fsm} text format into an {@link Automaton}.
 * 
 * The parser is an explicit state machine that consumes one line per step. A line that does not
 * match what the current parser state expects is reported as a diagnostic and discarded, and the
 * parser stays where it was. That way a well-formed remainder of a hand-edited file is still
 * recovered after a bad line, at the cost of a possibly incomplete automaton.
 * 
 * Outside of action blocks everything from the first unescaped {@code #} onwards is a comment
 * ({@code \#} stands for a literal {@code #}). Lines that are blank after comment stripping are
 * skipped, which also skips the {@code #name;x;y;in;out} layout preamble the editor keeps at the
 * top of the file. Inside {@code STATE ... ACTION ... END} lines are taken verbatim.
 * 
 * Instances hold no parse state and can be shared.
 */
public final class AutomatonParser {
  private static final Logger logger = LogManager.getLogger(AutomatonParser.class.getSimpleName());

  // indentation the serializer puts in front of every action line
  static final String ACTION_INDENT = "        ";

  /**
   * Parse the given text. Never fails; problems end up in the result's diagnostics.
   */
  public ParseResult parse(final String text) {
    final ParseRun run = new ParseRun();
    if (text != null && !text.isEmpty()) {
      final String[] lines = text.split("\n", -1);
      int count = lines.length;
      // a trailing newline terminates the last line rather than starting a new one
      if (lines[count - 1].isEmpty()) {
        count--;
      }
      for (int i = 0; i < count; i++) {
        run.accept(lines[i]);
      }
    }
    return run.finish();
  }

  /**
   * Parse everything readable from the given reader. The reader is not closed.
   */
  public ParseResult parse(final Reader reader) throws AutomatonException {
    final ParseRun run = new ParseRun();
    final BufferedReader buffered =
        reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
    try {
      String rawLine;
      while ((rawLine = buffered.readLine()) != null) {
        run.accept(rawLine);
      }
    } catch (IOException problem) {
      throw new AutomatonException(AutomatonException.Code.FILE_READ_FAILURE,
          "Failed reading automaton specification at line " + (run.lineNumber + 1), problem);
    }
    return run.finish();
  }

  /**
   * Parse a UTF-8 {@code .fsm} file.
   */
  public ParseResult parseFile(final Path file) throws AutomatonException {
    final ParseResult result;
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      result = parse(reader);
    } catch (IOException problem) {
      logger.error("Failed to open automaton specification " + file, problem);
      throw new AutomatonException(AutomatonException.Code.FILE_READ_FAILURE,
          "Failed to open automaton specification " + file, problem);
    }
    logger.info("Parsed automaton '" + result.getAutomaton().getName() + "' from " + file
        + " with " + result.getDiagnostics().size() + " diagnostic(s)");
    return result;
  }

  /**
   * Removes a comment starting at the first unescaped {@code #} and turns {@code \#} into
   * {@code #}.
   */
  static String stripComment(final String line) {
    final StringBuilder builder = new StringBuilder(line.length());
    for (int i = 0; i < line.length(); i++) {
      final char c = line.charAt(i);
      if (c == '\\' && i + 1 < line.length() && line.charAt(i + 1) == '#') {
        builder.append('#');
        i++;
      } else if (c == '#') {
        break;
      } else {
        builder.append(c);
      }
    }
    return builder.toString();
  }

  /**
   * Returns the argument of a keyword line. The keyword must be followed by whitespace or end the
   * line, so a bare keyword yields an empty argument.
   */
  static Optional<String> keywordArgument(final String line, final String keyword) {
    if (!line.startsWith(keyword)) {
      return Optional.empty();
    }
    if (line.length() == keyword.length()) {
      return Optional.of("");
    }
    if (!Character.isWhitespace(line.charAt(keyword.length()))) {
      return Optional.empty();
    }
    return Optional.of(line.substring(keyword.length()).trim());
  }

  private static String stripCarriageReturn(final String rawLine) {
    return rawLine.endsWith("\r") ? rawLine.substring(0, rawLine.length() - 1) : rawLine;
  }

  static enum ParserState {
    EXPECT_AUTOMATON("'AUTOMATON'"),
    EXPECT_DESCRIPTION("'DESCRIPTION'"),
    EXPECT_START("'START'"),
    EXPECT_FINISH("'FINISH'"),
    EXPECT_VARS("'VARS'"),
    INSIDE_VARS("a variable declaration or 'END'"),
    EXPECT_STATE_OR_TRANSITION("'STATE', 'TRANSITION' or 'END'"),
    EXPECT_STATE_ACTION("'ACTION'"),
    INSIDE_STATE_ACTION("action code or 'END'"),
    EXPECT_TRANSITION_CONDITION("'CONDITION'"),
    EXPECT_TRANSITION_DELAY("'DELAY'"),
    DONE("nothing");

    private final String expectation;

    private ParserState(final String expectation) {
      this.expectation = expectation;
    }

    String getExpectation() {
      return expectation;
    }
  }

  /**
   * Mutable state of a single parse.
   */
  private static final class ParseRun {
    private final Automaton automaton = new Automaton();
    private final List<ParseDiagnostic> diagnostics = new ArrayList<>();
    private ParserState state = ParserState.EXPECT_AUTOMATON;
    private int lineNumber;

    private String currentState;
    private String pendingFrom;
    private String pendingTo;
    private String pendingCondition;
    // carried over between transitions, only a well-formed DELAY changes it
    private int pendingDelay;

    void accept(final String rawLine) {
      lineNumber++;
      final String raw = stripCarriageReturn(rawLine);

      if (state == ParserState.INSIDE_STATE_ACTION) {
        if (raw.trim().equals("END")) {
          state = ParserState.EXPECT_STATE_OR_TRANSITION;
        } else {
          appendActionLine(raw);
        }
        return;
      }

      final String line = stripComment(raw).trim();
      if (line.isEmpty()) {
        return;
      }

      switch (state) {
        case EXPECT_AUTOMATON:
          onHeaderKeyword(line, "AUTOMATON", ParserState.EXPECT_DESCRIPTION);
          break;
        case EXPECT_DESCRIPTION:
          onHeaderKeyword(line, "DESCRIPTION", ParserState.EXPECT_START);
          break;
        case EXPECT_START:
          onHeaderKeyword(line, "START", ParserState.EXPECT_FINISH);
          break;
        case EXPECT_FINISH:
          onFinish(line);
          break;
        case EXPECT_VARS:
          if (line.equals("VARS")) {
            state = ParserState.INSIDE_VARS;
          } else {
            unexpected(line);
          }
          break;
        case INSIDE_VARS:
          onVariable(line);
          break;
        case EXPECT_STATE_OR_TRANSITION:
          onStateOrTransition(line);
          break;
        case EXPECT_STATE_ACTION:
          if (line.equals("ACTION")) {
            state = ParserState.INSIDE_STATE_ACTION;
          } else {
            unexpected(line);
          }
          break;
        case EXPECT_TRANSITION_CONDITION: {
          final Optional<String> condition = keywordArgument(line, "CONDITION");
          if (condition.isPresent()) {
            pendingCondition = condition.get();
            state = ParserState.EXPECT_TRANSITION_DELAY;
          } else {
            unexpected(line);
          }
          break;
        }
        case EXPECT_TRANSITION_DELAY:
          onDelay(line);
          break;
        case DONE:
          report(Category.STRUCTURAL, "Unexpected content after the final 'END'", line);
          break;
        default:
          unexpected(line);
      }
    }

    ParseResult finish() {
      if (state != ParserState.DONE) {
        report(Category.STRUCTURAL,
            "Unexpected end of input, expected " + state.getExpectation(), "");
      }
      return new ParseResult(automaton, diagnostics);
    }

    private void onHeaderKeyword(final String line, final String keyword,
        final ParserState next) {
      final Optional<String> argument = keywordArgument(line, keyword);
      if (!argument.isPresent()) {
        unexpected(line);
        return;
      }
      switch (keyword) {
        case "AUTOMATON":
          automaton.setName(argument.get());
          break;
        case "DESCRIPTION":
          automaton.setDescription(argument.get());
          break;
        default:
          automaton.setStartState(argument.get());
      }
      state = next;
    }

    private void onFinish(final String line) {
      final Optional<String> argument = keywordArgument(line, "FINISH");
      if (!argument.isPresent()) {
        unexpected(line);
        return;
      }
      final String names = argument.get().replace("[", "").replace("]", "");
      for (String token : names.split(",")) {
        final String name = token.trim();
        if (name.isEmpty()) {
          continue;
        }
        try {
          automaton.addFinalState(name);
        } catch (AutomatonException problem) {
          report(Category.FIELD, problem.getMessage(), line);
        }
      }
      state = ParserState.EXPECT_VARS;
    }

    private void onVariable(final String line) {
      if (line.equals("END")) {
        state = ParserState.EXPECT_STATE_OR_TRANSITION;
        return;
      }
      final int equals = line.indexOf('=');
      if (equals < 0) {
        report(Category.STRUCTURAL, "Malformed VARS line, missing '='", line);
        return;
      }
      final String typeAndName = line.substring(0, equals).trim();
      final String value = line.substring(equals + 1).trim();

      String typeToken = "";
      String name = typeAndName;
      int space = -1;
      for (int i = 0; i < typeAndName.length(); i++) {
        if (Character.isWhitespace(typeAndName.charAt(i))) {
          space = i;
          break;
        }
      }
      if (space >= 0) {
        typeToken = typeAndName.substring(0, space);
        name = typeAndName.substring(space + 1).trim();
      }
      if (name.isEmpty()) {
        report(Category.STRUCTURAL, "Malformed VARS line, missing variable name", line);
        return;
      }
      final VarDataType type = VarDataType.fromToken(typeToken);
      if (!type.getToken().equals(typeToken)) {
        report(Category.FIELD, "Unknown variable type '" + typeToken + "', defaulting to "
            + VarDataType.INT.getToken(), line);
      }
      try {
        automaton.addVariable(name, value, type);
      } catch (AutomatonException problem) {
        report(Category.STRUCTURAL, problem.getMessage(), line);
      }
    }

    private void onStateOrTransition(final String line) {
      if (line.equals("END")) {
        state = ParserState.DONE;
        return;
      }
      final Optional<String> stateName = keywordArgument(line, "STATE");
      if (stateName.isPresent()) {
        try {
          automaton.addState(stateName.get());
          currentState = stateName.get();
          state = ParserState.EXPECT_STATE_ACTION;
        } catch (AutomatonException problem) {
          report(Category.STRUCTURAL, "Malformed STATE line, missing state name", line);
        }
        return;
      }
      final Optional<String> endpoints = keywordArgument(line, "TRANSITION");
      if (endpoints.isPresent()) {
        final int arrow = endpoints.get().indexOf("->");
        final String from = arrow < 0 ? "" : endpoints.get().substring(0, arrow).trim();
        final String to = arrow < 0 ? "" : endpoints.get().substring(arrow + 2).trim();
        if (from.isEmpty() || to.isEmpty()) {
          report(Category.STRUCTURAL, "Malformed TRANSITION line, expected '<from> -> <to>'",
              line);
          return;
        }
        pendingFrom = from;
        pendingTo = to;
        pendingCondition = "";
        state = ParserState.EXPECT_TRANSITION_CONDITION;
        return;
      }
      unexpected(line);
    }

    private void onDelay(final String line) {
      final Optional<String> argument = keywordArgument(line, "DELAY");
      if (!argument.isPresent()) {
        unexpected(line);
        return;
      }
      try {
        final int parsed = Integer.parseInt(argument.get());
        if (parsed < 0) {
          report(Category.FIELD, "Negative DELAY value '" + argument.get() + "'", line);
        } else {
          pendingDelay = parsed;
        }
      } catch (NumberFormatException problem) {
        report(Category.FIELD, "Invalid DELAY value '" + argument.get() + "'", line);
      }
      try {
        automaton.addTransition(new Transition(pendingFrom, pendingTo, pendingCondition,
            pendingDelay));
      } catch (AutomatonException problem) {
        report(Category.STRUCTURAL, problem.getMessage(), line);
      }
      state = ParserState.EXPECT_STATE_OR_TRANSITION;
    }

    private void appendActionLine(final String raw) {
      final String line =
          raw.startsWith(ACTION_INDENT) ? raw.substring(ACTION_INDENT.length()) : raw;
      try {
        automaton.appendToAction(currentState, line);
      } catch (AutomatonException problem) {
        report(Category.STRUCTURAL, problem.getMessage(), raw);
      }
    }

    private void unexpected(final String line) {
      report(Category.STRUCTURAL, "Expected " + state.getExpectation(), line);
    }

    private void report(final Category category, final String message, final String line) {
      final ParseDiagnostic diagnostic = new ParseDiagnostic(lineNumber, category, message, line);
      diagnostics.add(diagnostic);
      logger.warn(diagnostic.toString());
    }
  }
}
