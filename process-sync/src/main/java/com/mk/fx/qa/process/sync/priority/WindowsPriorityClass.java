package com.mk.fx.qa.process.sync.priority;

import com.mk.fx.qa.process.sync.model.PriorityLevel;

/**
 * Windows variant. The HotSpot JVM on Windows maps Java thread priorities onto native thread
 * priorities, so LOW/NORMAL/HIGH become {@code MIN/NORM/MAX_PRIORITY}.
 */
public final class WindowsPriorityClass implements PrioritySetter {

  @Override
  public void apply(PriorityLevel level) throws PriorityUnsupportedException {
    try {
      Thread.currentThread().setPriority(level.threadPriority());
    } catch (SecurityException ex) {
      throw new PriorityUnsupportedException(level, "Thread priority denied: " + ex.getMessage(), ex);
    }
  }

  @Override
  public String name() {
    return "windows-priority-class";
  }
}
