package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Scratch state of one {@link ScriptGenerator#generate(Automaton)} call: the function table and
 * the transition counter. A new context is created for every call so repeated generation is
 * reproducible.
 */
final class GenerationContext {
  private static final Logger logger =
      LogManager.getLogger(GenerationContext.class.getSimpleName());

  // K=function identifier, V=body lines without indentation. Sorted for stable output.
  private final Map<String, List<String>> functions = new TreeMap<>();
  private int transitionCounter;

  /**
   * Registers a function body under an identifier. Re-registering an identical body is a no-op; a
   * different body replaces the earlier one.
   */
  void registerFunction(final String identifier, final List<String> body) {
    final List<String> previous =
        functions.put(identifier, Collections.unmodifiableList(new ArrayList<>(body)));
    if (previous != null && !previous.equals(body)) {
      logger.warn("Generated function '" + identifier
          + "' was registered twice with different bodies, keeping the last one");
    }
  }

  Map<String, List<String>> getFunctions() {
    return Collections.unmodifiableMap(functions);
  }

  /**
   * Unique identifier for the next transition object, {@code tr_<from>_to_<to>_<n>}.
   */
  String nextTransitionId(final String fromState, final String toState) {
    return "tr_" + ScriptLiterals.sanitizeIdentifier(fromState) + "_to_"
        + ScriptLiterals.sanitizeIdentifier(toState) + "_" + transitionCounter++;
  }

  int getTransitionCount() {
    return transitionCounter;
  }
}
