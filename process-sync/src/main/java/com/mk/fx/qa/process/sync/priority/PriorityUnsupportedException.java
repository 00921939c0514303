package com.mk.fx.qa.process.sync.priority;

import com.mk.fx.qa.process.sync.model.PriorityLevel;

/** A scheduling priority could not be applied. Never fatal: the worker runs at default priority. */
public class PriorityUnsupportedException extends Exception {

  private final PriorityLevel level;

  public PriorityUnsupportedException(PriorityLevel level, String message) {
    super(message);
    this.level = level;
  }

  public PriorityUnsupportedException(PriorityLevel level, String message, Throwable cause) {
    super(message, cause);
    this.level = level;
  }

  public PriorityLevel getLevel() {
    return level;
  }
}
