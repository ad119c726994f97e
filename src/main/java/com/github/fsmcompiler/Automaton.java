package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import com.github.fsmcompiler.AutomatonException.Code;
import com.github.fsmcompiler.VariableInfo.VarDataType;

/**
 * In-memory specification of a finite state machine.
 * 
 * Notes for users:<br>
 * 1. states and transitions are kept as flat tables. A state is a name mapped to its action code;
 * a transition refers to its endpoints by name. Nothing here checks that the start state or the
 * transition endpoints actually exist.<br>
 * 
 * 2. iteration order of states, final states, transitions and variables is insertion order. The
 * serializer and the script generator depend on it for deterministic output, and transition order
 * is the evaluation priority at runtime.<br>
 * 
 * 3. this object is not thread-safe. Callers must not mutate it while a parse, serialize or
 * generate call is working on it.<br>
 * 
 * 4. action text is normalized when stored: line endings become {@code \n} and non-empty text
 * always ends with a newline.<br>
 * 
 * 5. names, the description, the start state, variable names and values and transition
 * conditions are single-line fields: they are stored trimmed, with line breaks turned into
 * spaces.<br>
 */
public final class Automaton {
  private String name = "";
  private String description = "";
  // empty means unset
  private String startState = "";
  private final Map<String, String> states = new LinkedHashMap<>();
  private final Set<String> finalStates = new LinkedHashSet<>();
  private final List<Transition> transitions = new ArrayList<>();
  private final List<VariableInfo> variables = new ArrayList<>();

  ///// Automaton info /////
  public String getName() {
    return name;
  }

  public void setName(final String name) {
    this.name = singleLineField(name);
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(final String description) {
    this.description = singleLineField(description);
  }

  ///// States /////
  public String getStartState() {
    return startState;
  }

  public boolean hasStartState() {
    return !startState.isEmpty();
  }

  public void setStartState(final String stateName) {
    this.startState = singleLineField(stateName);
  }

  public void addState(final String stateName) throws AutomatonException {
    addState(stateName, "");
  }

  /**
   * Adds a state or replaces the action code of an existing one.
   */
  public void addState(final String stateName, final String action) throws AutomatonException {
    validateStateName(stateName);
    states.put(singleLineField(stateName), normalizeAction(action));
  }

  public boolean hasState(final String stateName) {
    return states.containsKey(stateName);
  }

  public void setStateAction(final String stateName, final String action)
      throws AutomatonException {
    if (!states.containsKey(stateName)) {
      throw new AutomatonException(Code.INVALID_STATE_NAME, "No such state: " + stateName);
    }
    states.put(stateName, normalizeAction(action));
  }

  /**
   * Appends one line, plus a newline, to the action code of a state. The state is created if it
   * does not exist yet.
   */
  public void appendToAction(final String stateName, final String line)
      throws AutomatonException {
    validateStateName(stateName);
    final String key = singleLineField(stateName);
    final String current = states.getOrDefault(key, "");
    states.put(key, current + stripLineBreak(line) + "\n");
  }

  public String getStateAction(final String stateName) {
    final String action = states.get(stateName);
    return action == null ? "" : action;
  }

  /**
   * Removes a state together with its final flag, the start marker when it pointed here and every
   * transition entering or leaving it. Returns false if no such state existed.
   */
  public boolean removeState(final String stateName) {
    if (states.remove(stateName) == null) {
      return false;
    }
    finalStates.remove(stateName);
    if (startState.equals(stateName)) {
      startState = "";
    }
    final Iterator<Transition> iterator = transitions.iterator();
    while (iterator.hasNext()) {
      final Transition transition = iterator.next();
      if (transition.getFromState().equals(stateName)
          || transition.getToState().equals(stateName)) {
        iterator.remove();
      }
    }
    return true;
  }

  /**
   * Renames a state in place, keeping its position in iteration order, and rewrites every
   * reference to it.
   */
  public void renameState(final String oldName, final String requestedName)
      throws AutomatonException {
    validateStateName(requestedName);
    final String newName = singleLineField(requestedName);
    if (!states.containsKey(oldName)) {
      throw new AutomatonException(Code.INVALID_STATE_NAME, "No such state: " + oldName);
    }
    if (oldName.equals(newName)) {
      return;
    }
    if (states.containsKey(newName)) {
      throw new AutomatonException(Code.INVALID_STATE_NAME, "State already exists: " + newName);
    }
    final Map<String, String> renamed = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : states.entrySet()) {
      renamed.put(entry.getKey().equals(oldName) ? newName : entry.getKey(), entry.getValue());
    }
    states.clear();
    states.putAll(renamed);

    final Set<String> renamedFinals = new LinkedHashSet<>();
    for (String finalState : finalStates) {
      renamedFinals.add(finalState.equals(oldName) ? newName : finalState);
    }
    finalStates.clear();
    finalStates.addAll(renamedFinals);

    if (startState.equals(oldName)) {
      startState = newName;
    }
    for (int i = 0; i < transitions.size(); i++) {
      final Transition transition = transitions.get(i);
      final String from =
          transition.getFromState().equals(oldName) ? newName : transition.getFromState();
      final String to = transition.getToState().equals(oldName) ? newName : transition.getToState();
      if (!from.equals(transition.getFromState()) || !to.equals(transition.getToState())) {
        transitions.set(i, transition.withEndpoints(from, to));
      }
    }
  }

  /**
   * Unmodifiable view of state name to action code, in insertion order.
   */
  public Map<String, String> getStates() {
    return Collections.unmodifiableMap(states);
  }

  /**
   * Adding a state that is already final is a no-op.
   */
  public void addFinalState(final String stateName) throws AutomatonException {
    validateStateName(stateName);
    finalStates.add(singleLineField(stateName));
  }

  public boolean removeFinalState(final String stateName) {
    return finalStates.remove(stateName);
  }

  public boolean isFinalState(final String stateName) {
    return finalStates.contains(stateName);
  }

  public Set<String> getFinalStates() {
    return Collections.unmodifiableSet(finalStates);
  }

  ///// Transitions /////
  public void addTransition(final Transition transition) {
    transitions.add(Objects.requireNonNull(transition, "transition"));
  }

  public boolean removeTransition(final Transition transition) {
    return transitions.remove(transition);
  }

  public List<Transition> getTransitions() {
    return Collections.unmodifiableList(transitions);
  }

  public List<Transition> getTransitionsFrom(final String stateName) {
    final List<Transition> result = new ArrayList<>();
    for (Transition transition : transitions) {
      if (transition.getFromState().equals(stateName)) {
        result.add(transition);
      }
    }
    return result;
  }

  ///// Variables /////
  /**
   * Appends a variable declaration. Names are not deduplicated.
   */
  public void addVariable(final String varName, final String varValue, final VarDataType type)
      throws AutomatonException {
    variables.add(new VariableInfo(varName, varValue, type));
  }

  /**
   * Removes every declaration carrying the given name.
   */
  public boolean removeVariable(final String varName) {
    boolean removed = false;
    final Iterator<VariableInfo> iterator = variables.iterator();
    while (iterator.hasNext()) {
      if (iterator.next().getName().equals(varName)) {
        iterator.remove();
        removed = true;
      }
    }
    return removed;
  }

  public Optional<VariableInfo> findVariable(final String varName) {
    for (VariableInfo variable : variables) {
      if (variable.getName().equals(varName)) {
        return Optional.of(variable);
      }
    }
    return Optional.empty();
  }

  public List<VariableInfo> getVariables() {
    return Collections.unmodifiableList(variables);
  }

  static String normalizeAction(final String action) {
    if (action == null || action.isEmpty()) {
      return "";
    }
    String normalized = action.replace("\r\n", "\n").replace('\r', '\n');
    if (!normalized.endsWith("\n")) {
      normalized = normalized + "\n";
    }
    return normalized;
  }

  /**
   * Single-line fields are stored the way the text format reads them back: line breaks become
   * spaces and surrounding whitespace is dropped.
   */
  static String singleLineField(final String field) {
    if (field == null) {
      return "";
    }
    return field.replace("\r\n", " ").replace('\r', ' ').replace('\n', ' ').trim();
  }

  private static String stripLineBreak(final String line) {
    if (line == null) {
      return "";
    }
    return line.replace("\r", "").replace("\n", "");
  }

  private static void validateStateName(final String stateName) throws AutomatonException {
    if (stateName == null || stateName.trim().isEmpty()) {
      throw new AutomatonException(Code.INVALID_STATE_NAME);
    }
  }

  /**
   * Two automata are equal when they carry the same name, description, start state, final state
   * set, state to action map, transition list and variable list. Final states and states are
   * compared regardless of insertion order.
   */
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    Automaton other = (Automaton) obj;
    return name.equals(other.name) && description.equals(other.description)
        && startState.equals(other.startState) && finalStates.equals(other.finalStates)
        && states.equals(other.states) && transitions.equals(other.transitions)
        && variables.equals(other.variables);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, description, startState, finalStates, states, transitions,
        variables);
  }

  @Override
  public String toString() {
    return "Automaton [name=" + name + ", description=" + description + ", startState="
        + startState + ", finalStates=" + finalStates + ", states=" + states.keySet()
        + ", transitions=" + transitions + ", variables=" + variables + "]";
  }
}
