package com.github.fsmcompiler;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Writes an {@link Automaton} in the {@code .fsm} text format read by {@link AutomatonParser}.
 * 
 * The output always has the same structure: an optional layout preamble, the AUTOMATON header with
 * its VARS block, one STATE block per state, one TRANSITION block per transition and a closing
 * END. Serialization never fails for a well-formed automaton, and parsing the output gives back an
 * equal automaton.
 * 
 * Known limits of the format: names must not contain {@code ->} or {@code ,}, variable names must
 * not contain {@code =}, and an action line consisting of just {@code END} ends the action block.
 */
public final class AutomatonSerializer {
  private static final Logger logger =
      LogManager.getLogger(AutomatonSerializer.class.getSimpleName());

  private static final String BLOCK_INDENT = "    ";
  private static final String VARIABLE_INDENT = "        ";

  public String serialize(final Automaton automaton) {
    return serialize(automaton, null);
  }

  /**
   * Serializes the automaton preceded by one layout line per state. States without an entry in
   * the layout map get a default layout. Passing null omits the preamble.
   */
  public String serialize(final Automaton automaton, final Map<String, NodeLayout> layouts) {
    final StringBuilder out = new StringBuilder();
    if (layouts != null) {
      for (String stateName : automaton.getStates().keySet()) {
        final NodeLayout layout = layouts.getOrDefault(stateName, NodeLayout.DEFAULT);
        out.append(layout.toPreambleLine(stateName)).append('\n');
      }
    }

    out.append("AUTOMATON ").append(escape(automaton.getName())).append('\n');
    out.append(BLOCK_INDENT).append("DESCRIPTION ").append(escape(automaton.getDescription()))
        .append('\n');
    out.append(BLOCK_INDENT).append("START ").append(escape(automaton.getStartState()))
        .append('\n');
    out.append(BLOCK_INDENT).append("FINISH [");
    boolean first = true;
    for (String finalState : automaton.getFinalStates()) {
      if (!first) {
        out.append(", ");
      }
      out.append(escape(finalState));
      first = false;
    }
    out.append("]\n");

    out.append(BLOCK_INDENT).append("VARS\n");
    for (VariableInfo variable : automaton.getVariables()) {
      out.append(VARIABLE_INDENT).append(variable.getType().getToken()).append(' ')
          .append(escape(variable.getName())).append(" = ").append(escape(variable.getValue()))
          .append('\n');
    }
    out.append(BLOCK_INDENT).append("END\n\n");

    for (Map.Entry<String, String> state : automaton.getStates().entrySet()) {
      out.append("STATE ").append(escape(state.getKey())).append('\n');
      out.append(BLOCK_INDENT).append("ACTION\n");
      for (String line : actionLines(state.getValue())) {
        if (!line.isEmpty()) {
          out.append(AutomatonParser.ACTION_INDENT).append(line);
        }
        out.append('\n');
      }
      out.append(BLOCK_INDENT).append("END\n\n");
    }

    for (Transition transition : automaton.getTransitions()) {
      out.append("TRANSITION ").append(escape(transition.getFromState())).append(" -> ")
          .append(escape(transition.getToState())).append('\n');
      out.append(BLOCK_INDENT).append("CONDITION ").append(escape(transition.getCondition()))
          .append('\n');
      out.append(BLOCK_INDENT).append("DELAY ").append(transition.getDelay()).append("\n\n");
    }

    out.append("END\n");
    return out.toString();
  }

  /**
   * Serializes and writes the automaton to a UTF-8 file, replacing any previous content. The text
   * is fully rendered before the file is opened.
   */
  public void writeFile(final Automaton automaton, final Map<String, NodeLayout> layouts,
      final Path file) throws AutomatonException {
    final String text = serialize(automaton, layouts);
    OutputFiles.write(file, text.getBytes(StandardCharsets.UTF_8));
    logger.info("Saved automaton '" + automaton.getName() + "' with "
        + automaton.getStates().size() + " state(s) and " + automaton.getTransitions().size()
        + " transition(s) to " + file);
  }

  /**
   * Lines of an action text, without the terminating newline of the last line.
   */
  static String[] actionLines(final String action) {
    if (action.isEmpty()) {
      return new String[0];
    }
    final String body = action.endsWith("\n") ? action.substring(0, action.length() - 1) : action;
    return body.split("\n", -1);
  }

  /**
   * Single-line fields are written on keyword lines where {@code #} starts a comment, and cannot
   * span lines.
   */
  static String escape(final String field) {
    return field.replace("#", "\\#").replace("\r", " ").replace("\n", " ");
  }
}
