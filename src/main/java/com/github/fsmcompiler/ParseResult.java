package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.github.fsmcompiler.ParseDiagnostic.Category;

/**
 * Outcome of a parse: the automaton recovered from the input, possibly incomplete, and the
 * diagnostics reported on the way in input order.
 */
public final class ParseResult {
  private final Automaton automaton;
  private final List<ParseDiagnostic> diagnostics;

  ParseResult(final Automaton automaton, final List<ParseDiagnostic> diagnostics) {
    this.automaton = automaton;
    this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
  }

  public Automaton getAutomaton() {
    return automaton;
  }

  public List<ParseDiagnostic> getDiagnostics() {
    return diagnostics;
  }

  public boolean isClean() {
    return diagnostics.isEmpty();
  }

  public List<ParseDiagnostic> getDiagnostics(final Category category) {
    final List<ParseDiagnostic> filtered = new ArrayList<>();
    for (ParseDiagnostic diagnostic : diagnostics) {
      if (diagnostic.getCategory() == category) {
        filtered.add(diagnostic);
      }
    }
    return filtered;
  }

  @Override
  public String toString() {
    return "ParseResult [automaton=" + automaton.getName() + ", diagnostics=" + diagnostics + "]";
  }
}
