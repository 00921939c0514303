package com.mk.fx.qa.process.sync.model;

import java.util.Arrays;

/**
 * Lifecycle of a single worker: {@code STARTING → RUNNING ⇄ PAUSED → COMPLETED | TERMINATED}.
 *
 * <p>Any non-terminal state may move to {@link #TERMINATED}. Terminal states accept no further
 * transitions.
 */
public enum WorkerState {
  STARTING,
  RUNNING,
  PAUSED,
  COMPLETED,
  TERMINATED;

  public boolean isTerminal() {
    return this == COMPLETED || this == TERMINATED;
  }

  /** Returns whether moving from this state to {@code next} is a legal lifecycle step. */
  public boolean canTransitionTo(WorkerState next) {
    return switch (this) {
      case STARTING -> next == RUNNING || next == TERMINATED;
      case RUNNING -> next == PAUSED || next == COMPLETED || next == TERMINATED;
      case PAUSED -> next == RUNNING || next == TERMINATED;
      case COMPLETED, TERMINATED -> false;
    };
  }

  public static WorkerState fromValue(String value) {
    return Arrays.stream(values())
        .filter(state -> state.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown worker state: " + value));
  }
}
