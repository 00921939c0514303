package com.mk.fx.qa.process.sync.priority;

import com.mk.fx.qa.process.sync.model.PriorityLevel;

/** Used on hosts with no supported priority mechanism; every request is reported unsupported. */
public final class NoopPriority implements PrioritySetter {

  private final String osName;

  public NoopPriority(String osName) {
    this.osName = osName;
  }

  @Override
  public void apply(PriorityLevel level) throws PriorityUnsupportedException {
    throw new PriorityUnsupportedException(
        level, "Scheduling priority is not supported on " + osName);
  }

  @Override
  public String name() {
    return "noop";
  }
}
