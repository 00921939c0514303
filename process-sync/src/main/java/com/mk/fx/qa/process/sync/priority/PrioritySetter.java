package com.mk.fx.qa.process.sync.priority;

import com.mk.fx.qa.process.sync.model.PriorityLevel;

/**
 * Best-effort scheduling priority capability. Applies to the calling thread; one implementation
 * is selected per host at startup by {@link PrioritySetters#forCurrentPlatform()}.
 */
public interface PrioritySetter {

  /**
   * Applies {@code level} to the current thread.
   *
   * @throws PriorityUnsupportedException if the host refused or cannot express the level
   */
  void apply(PriorityLevel level) throws PriorityUnsupportedException;

  /** Short name used in logs. */
  String name();
}
