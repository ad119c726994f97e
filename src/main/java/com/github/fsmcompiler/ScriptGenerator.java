package com.github.fsmcompiler;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Transpiles an {@link Automaton} into a self-contained script for the external FSM runtime.
 * 
 * Notes for users:<br>
 * 1. every state gets an action function and every distinct condition a condition function. The
 * functions are deduplicated by identifier and emitted in sorted order.<br>
 * 
 * 2. action code runs against locals: each declared variable is read from the runtime store into a
 * local before the user's code and written back after it.<br>
 * 
 * 3. conditions are rewritten so that every whole-token reference to a declared variable outside
 * of string literals becomes a runtime store lookup.<br>
 * 
 * 4. the driver section builds states and transitions, seeds variables, connects to the editor's
 * runtime client and always stops the machine on the way out.<br>
 * 
 * 5. output is byte-for-byte reproducible for the same automaton. Start state and transition
 * endpoints are not checked; a reference to a missing state ends up as a reference to an undefined
 * name in the script.<br>
 */
public final class ScriptGenerator {
  private static final Logger logger = LogManager.getLogger(ScriptGenerator.class.getSimpleName());

  static final String ALWAYS_TRUE_CONDITION = "always_true_condition";
  static final String FUNCTION_PARAMETERS = "(fsm, variables)";

  private static final String INDENT = "    ";
  private static final String HANDLER_EXCEPTION = "e";
  private static final Pattern TRANSITION_ID = Pattern.compile("tr_.*_to_.*_\\d+");
  private static final Pattern NAME_DIRECTIVE = Pattern.compile("#\\s*name\\s*=\\s*(\\S.*)");

  private final CompilerConfiguration config;

  public ScriptGenerator() {
    this(CompilerConfiguration.defaults());
  }

  public ScriptGenerator(final CompilerConfiguration config) {
    this.config = config;
  }

  /**
   * Generates the script and writes it to the given file, replacing any previous content.
   */
  public void generate(final Automaton automaton, final Path outputFile)
      throws AutomatonException {
    final String script = generate(automaton);
    OutputFiles.write(outputFile, script.getBytes(StandardCharsets.UTF_8));
    logger.info("Generated script for automaton '" + automaton.getName() + "' to " + outputFile);
  }

  public String generate(final Automaton automaton) {
    final GenerationContext context = new GenerationContext();
    context.registerFunction(ALWAYS_TRUE_CONDITION, Collections.singletonList("return True"));

    // K=state name, V=action function identifier
    final Map<String, String> actionFunctions = new LinkedHashMap<>();
    for (Map.Entry<String, String> state : automaton.getStates().entrySet()) {
      actionFunctions.put(state.getKey(),
          registerAction(context, state.getKey(), state.getValue(), automaton.getVariables()));
    }
    for (Transition transition : automaton.getTransitions()) {
      if (transition.hasCondition()) {
        context.registerFunction(conditionIdentifier(transition.getCondition()),
            Collections.singletonList("return (" + rewriteCondition(transition.getCondition(),
                automaton.getVariables()) + ")"));
      }
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Function table for '" + automaton.getName() + "': "
          + context.getFunctions().keySet());
    }

    final StringBuilder out = new StringBuilder();
    writeHeader(out, automaton);
    for (Map.Entry<String, List<String>> function : context.getFunctions().entrySet()) {
      out.append("def ").append(function.getKey()).append(FUNCTION_PARAMETERS).append(":\n");
      for (String line : function.getValue()) {
        if (!line.isEmpty()) {
          out.append(INDENT).append(line);
        }
        out.append('\n');
      }
      out.append("\n\n");
    }
    writeDriver(out, automaton, actionFunctions, context);
    if (logger.isDebugEnabled()) {
      logger.debug("Generated " + context.getFunctions().size() + " function(s) and "
          + context.getTransitionCount() + " transition(s) for '" + automaton.getName() + "'");
    }
    return out.toString();
  }

  private String registerAction(final GenerationContext context, final String stateName,
      final String action, final List<VariableInfo> variables) {
    final List<String> lines =
        new ArrayList<>(Arrays.asList(AutomatonSerializer.actionLines(action)));
    String identifier = "action_" + ScriptLiterals.sanitizeIdentifier(stateName);
    if (!lines.isEmpty()) {
      final Matcher directive = NAME_DIRECTIVE.matcher(lines.get(0).trim());
      if (directive.matches()) {
        identifier = ScriptLiterals.sanitizeIdentifier(directive.group(1).trim());
        lines.remove(0);
      }
    }
    if (!lines.isEmpty() && !config.getActionPlaceholder().isEmpty()
        && lines.get(0).trim().equals(config.getActionPlaceholder())) {
      lines.remove(0);
    }
    if (isNoOp(lines)) {
      context.registerFunction(identifier, Collections.singletonList("pass"));
    } else {
      context.registerFunction(identifier, transformToLocalVariables(dedent(lines), variables));
    }
    return identifier;
  }

  /**
   * Wraps action code in bindings from the runtime store to locals and write-backs from the
   * locals to the store.
   */
  static List<String> transformToLocalVariables(final List<String> code,
      final List<VariableInfo> variables) {
    // K=local identifier, V=store key
    final Map<String, String> locals = new LinkedHashMap<>();
    for (VariableInfo variable : variables) {
      locals.putIfAbsent(ScriptLiterals.sanitizeIdentifier(variable.getName()), variable.getName());
    }
    final List<String> body = new ArrayList<>(code.size() + 2 * locals.size());
    for (Map.Entry<String, String> local : locals.entrySet()) {
      body.add(local.getKey() + " = fsm.get_variable(" + ScriptLiterals.quote(local.getValue())
          + ")");
    }
    body.addAll(code);
    for (Map.Entry<String, String> local : locals.entrySet()) {
      body.add("fsm.set_variable(" + ScriptLiterals.quote(local.getValue()) + ", "
          + local.getKey() + ")");
    }
    return body;
  }

  /**
   * Replaces whole-token references to declared variables with runtime store lookups. Text inside
   * string literals and attribute names after a dot are left alone.
   */
  static String rewriteCondition(final String condition, final List<VariableInfo> variables) {
    final String expression = condition.trim().replace("\r", " ").replace("\n", " ");
    final Set<String> names = new LinkedHashSet<>();
    for (VariableInfo variable : variables) {
      names.add(variable.getName());
    }
    if (names.isEmpty()) {
      return expression;
    }
    final List<String> ordered = new ArrayList<>(names);
    // longest first so that a name is never matched as part of a longer one
    Collections.sort(ordered, Comparator.comparingInt(String::length).reversed());
    final StringBuilder alternatives = new StringBuilder();
    for (String name : ordered) {
      if (alternatives.length() > 0) {
        alternatives.append('|');
      }
      alternatives.append(Pattern.quote(name));
    }
    final Pattern reference =
        Pattern.compile("(?<![A-Za-z0-9_.])(?:" + alternatives + ")(?![A-Za-z0-9_])");

    final StringBuilder out = new StringBuilder(expression.length() + 32);
    int segmentStart = 0;
    int i = 0;
    while (i < expression.length()) {
      final char c = expression.charAt(i);
      if (c == '"' || c == '\'') {
        out.append(replaceReferences(expression.substring(segmentStart, i), reference));
        final int end = endOfStringLiteral(expression, i);
        out.append(expression, i, end);
        i = end;
        segmentStart = end;
      } else {
        i++;
      }
    }
    out.append(replaceReferences(expression.substring(segmentStart), reference));
    return out.toString();
  }

  static String conditionIdentifier(final String condition) {
    return "condition_" + ScriptLiterals.sanitizeIdentifier(condition.trim());
  }

  private static String replaceReferences(final String code, final Pattern reference) {
    final Matcher matcher = reference.matcher(code);
    final StringBuffer replaced = new StringBuffer(code.length() + 32);
    while (matcher.find()) {
      matcher.appendReplacement(replaced, Matcher.quoteReplacement(
          "fsm.get_variable(" + ScriptLiterals.quote(matcher.group()) + ")"));
    }
    matcher.appendTail(replaced);
    return replaced.toString();
  }

  /**
   * Index just past the literal opened at {@code start}, or the end of input if it is unterminated.
   */
  private static int endOfStringLiteral(final String expression, final int start) {
    final char quote = expression.charAt(start);
    int i = start + 1;
    while (i < expression.length()) {
      final char c = expression.charAt(i);
      if (c == '\\') {
        i += 2;
        continue;
      }
      i++;
      if (c == quote) {
        return i;
      }
    }
    return expression.length();
  }

  /**
   * True when no line carries a statement, only blanks and comments.
   */
  private static boolean isNoOp(final List<String> lines) {
    for (String line : lines) {
      final String trimmed = line.trim();
      if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
        return false;
      }
    }
    return true;
  }

  /**
   * Removes the indentation common to all non-blank lines.
   */
  private static List<String> dedent(final List<String> lines) {
    int common = Integer.MAX_VALUE;
    for (String line : lines) {
      if (line.trim().isEmpty()) {
        continue;
      }
      int indent = 0;
      while (indent < line.length()
          && (line.charAt(indent) == ' ' || line.charAt(indent) == '\t')) {
        indent++;
      }
      common = Math.min(common, indent);
    }
    final List<String> dedented = new ArrayList<>(lines.size());
    for (String line : lines) {
      if (line.trim().isEmpty()) {
        dedented.add("");
      } else {
        dedented.add(line.substring(common));
      }
    }
    return dedented;
  }

  private void writeHeader(final StringBuilder out, final Automaton automaton) {
    out.append("from ").append(config.getRuntimeModule())
        .append(" import FSM, State, Transition\n");
    out.append("import time\n");
    out.append("import logging\n\n");

    out.append("# --- FSM Name: ").append(singleLine(automaton.getName())).append(" ---\n");
    if (!automaton.getDescription().isEmpty()) {
      out.append("# Description: ").append(singleLine(automaton.getDescription())).append('\n');
    }
    out.append('\n');
    out.append("# --- Define FSM Actions and Conditions ---\n\n");
  }

  private void writeDriver(final StringBuilder out, final Automaton automaton,
      final Map<String, String> actionFunctions, final GenerationContext context) {
    final String fsm = engineIdentifier(automaton, context.getFunctions().keySet());

    out.append("# --- Main FSM Execution ---\n");
    out.append("if __name__ == \"__main__\":\n");
    out.append(INDENT).append("# 1. Create the FSM instance\n");
    out.append(INDENT).append(fsm).append(" = FSM()\n\n");

    out.append(INDENT).append("# 2. Define States\n");
    for (Map.Entry<String, String> state : actionFunctions.entrySet()) {
      final String stateName = state.getKey();
      out.append(INDENT).append(stateVariable(stateName)).append(" = State(\n");
      out.append(INDENT).append(INDENT).append("name=").append(ScriptLiterals.quote(stateName))
          .append(",\n");
      out.append(INDENT).append(INDENT).append("action=").append(state.getValue()).append(",\n");
      out.append(INDENT).append(INDENT).append("is_start_state=")
          .append(stateName.equals(automaton.getStartState()) ? "True" : "False").append(",\n");
      out.append(INDENT).append(INDENT).append("is_finish_state=")
          .append(automaton.isFinalState(stateName) ? "True" : "False").append('\n');
      out.append(INDENT).append(")\n");
    }
    out.append('\n');

    out.append(INDENT).append("# 3. Define Transitions\n");
    final List<String> wiring = new ArrayList<>();
    for (Transition transition : automaton.getTransitions()) {
      final String transitionId =
          context.nextTransitionId(transition.getFromState(), transition.getToState());
      final String condition = transition.hasCondition()
          ? conditionIdentifier(transition.getCondition()) : ALWAYS_TRUE_CONDITION;
      out.append(INDENT).append(transitionId).append(" = Transition(\n");
      out.append(INDENT).append(INDENT).append("target_state_name=")
          .append(ScriptLiterals.quote(transition.getToState())).append(",\n");
      out.append(INDENT).append(INDENT).append("condition=").append(condition).append(",\n");
      out.append(INDENT).append(INDENT).append("delay=").append(transition.getDelay())
          .append('\n');
      out.append(INDENT).append(")\n");
      wiring.add(stateVariable(transition.getFromState()) + ".add_transition(" + transitionId
          + ")");
    }
    out.append('\n');

    out.append(INDENT).append("# 4. Add Transitions to States\n");
    for (String line : wiring) {
      out.append(INDENT).append(line).append('\n');
    }
    out.append('\n');

    out.append(INDENT).append("# 5. Add States to FSM\n");
    for (String stateName : actionFunctions.keySet()) {
      out.append(INDENT).append(fsm).append(".add_state(").append(stateVariable(stateName))
          .append(")\n");
    }
    out.append('\n');

    out.append(INDENT).append("# 6. Set Initial Variables\n");
    for (VariableInfo variable : automaton.getVariables()) {
      out.append(INDENT).append(fsm).append(".set_variable(")
          .append(ScriptLiterals.quote(variable.getName())).append(", ")
          .append(ScriptLiterals.classify(variable.getValue()).getText()).append(")\n");
    }
    out.append('\n');

    out.append(INDENT).append("# 7. Connect to client and Run the FSM\n");
    out.append(INDENT).append("client_host = '").append(config.getClientHost()).append("'\n");
    out.append(INDENT).append("client_port = ").append(config.getClientPort()).append("\n\n");
    out.append(INDENT).append("print(")
        .append(ScriptLiterals.quote("Starting FSM '" + automaton.getName() + "'..."))
        .append(")\n");
    out.append(INDENT).append(fsm)
        .append(".connect_to_client(host=client_host, port=client_port)\n\n");
    out.append(INDENT).append("if ").append(fsm).append("._client_socket:\n");
    out.append(INDENT).append(INDENT).append("try:\n");
    out.append(INDENT).append(INDENT).append(INDENT).append(fsm).append(".run()\n");
    out.append(INDENT).append(INDENT).append("except KeyboardInterrupt:\n");
    out.append(INDENT).append(INDENT).append(INDENT)
        .append("print(\"\\nFSM execution interrupted by user (Ctrl+C).\")\n");
    out.append(INDENT).append(INDENT).append("except Exception as ").append(HANDLER_EXCEPTION)
        .append(":\n");
    out.append(INDENT).append(INDENT).append(INDENT)
        .append("logging.error(f\"An unexpected error occurred during FSM execution: {")
        .append(HANDLER_EXCEPTION).append("}\",")
        .append(" exc_info=True)\n");
    out.append(INDENT).append(INDENT).append("finally:\n");
    out.append(INDENT).append(INDENT).append(INDENT).append(fsm).append(".stop()\n");
    out.append(INDENT).append(INDENT).append(INDENT)
        .append("print(\"FSM runner script finished.\")\n");
    out.append(INDENT).append("else:\n");
    out.append(INDENT).append(INDENT)
        .append("print(\"FSM did not connect to a client. Exiting.\")\n");
  }

  /**
   * Variable holding the engine instance. It must not rebind a generated function, a state or
   * transition variable or the exception name of the driver's handler.
   */
  static String engineIdentifier(final Automaton automaton, final Set<String> functions) {
    final Set<String> taken = new HashSet<>(functions);
    for (String stateName : automaton.getStates().keySet()) {
      taken.add(stateVariable(stateName));
    }
    taken.add(HANDLER_EXCEPTION);
    String identifier = ScriptLiterals.sanitizeIdentifier(automaton.getName());
    while (taken.contains(identifier) || TRANSITION_ID.matcher(identifier).matches()) {
      identifier = identifier + ScriptLiterals.RESERVED_SUFFIX;
    }
    return identifier;
  }

  static String stateVariable(final String stateName) {
    return "state_" + ScriptLiterals.sanitizeIdentifier(stateName);
  }

  private static String singleLine(final String text) {
    return text.replace("\r", " ").replace("\n", " ");
  }
}
