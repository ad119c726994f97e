package com.github.fsmcompiler;

import com.github.fsmcompiler.AutomatonException.Code;

/**
 * An immutable directed edge between two states, referenced by name. Endpoints are not checked
 * against the states of any automaton. An empty condition means the transition is always taken.
 */
public final class Transition {
  private final String fromState;
  private final String toState;
  private final String condition;
  private final int delay;

  public Transition(final String fromState, final String toState) throws AutomatonException {
    this(fromState, toState, "", 0);
  }

  public Transition(final String fromState, final String toState, final String condition,
      final int delay) throws AutomatonException {
    if (fromState == null || fromState.trim().isEmpty() || toState == null
        || toState.trim().isEmpty()) {
      throw new AutomatonException(Code.INVALID_TRANSITION,
          "Transition endpoints cannot be blank: " + fromState + "->" + toState);
    }
    if (delay < 0) {
      throw new AutomatonException(Code.INVALID_DELAY,
          "Transition " + fromState + "->" + toState + " has negative delay " + delay);
    }
    this.fromState = Automaton.singleLineField(fromState);
    this.toState = Automaton.singleLineField(toState);
    this.condition = Automaton.singleLineField(condition);
    this.delay = delay;
  }

  public String getFromState() {
    return fromState;
  }

  public String getToState() {
    return toState;
  }

  public String getCondition() {
    return condition;
  }

  public boolean hasCondition() {
    return !condition.trim().isEmpty();
  }

  /**
   * Delay in milliseconds before the transition completes.
   */
  public int getDelay() {
    return delay;
  }

  Transition withEndpoints(final String newFromState, final String newToState)
      throws AutomatonException {
    return new Transition(newFromState, newToState, condition, delay);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + fromState.hashCode();
    result = prime * result + toState.hashCode();
    result = prime * result + condition.hashCode();
    result = prime * result + delay;
    return result;
  }

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
    Transition other = (Transition) obj;
    return fromState.equals(other.fromState) && toState.equals(other.toState)
        && condition.equals(other.condition) && delay == other.delay;
  }

  @Override
  public String toString() {
    return "Transition [fromState=" + fromState + ", toState=" + toState + ", condition="
        + condition + ", delay=" + delay + "]";
  }
}
