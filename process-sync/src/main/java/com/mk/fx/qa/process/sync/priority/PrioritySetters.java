package com.mk.fx.qa.process.sync.priority;

import java.util.Locale;
import lombok.extern.slf4j.Slf4j;

/** Selects the {@link PrioritySetter} variant for the running host. */
@Slf4j
public final class PrioritySetters {

  private PrioritySetters() {
    throw new UnsupportedOperationException("PrioritySetters cannot be instantiated");
  }

  public static PrioritySetter forCurrentPlatform() {
    return forOs(System.getProperty("os.name", "unknown"));
  }

  static PrioritySetter forOs(String osName) {
    String normalised = osName.toLowerCase(Locale.ROOT);
    PrioritySetter setter;
    if (normalised.startsWith("windows")) {
      setter = new WindowsPriorityClass();
    } else if (normalised.contains("linux")) {
      setter = new PosixNicePriority();
    } else {
      setter = new NoopPriority(osName);
    }
    log.info("Using {} priority setter for host OS '{}'", setter.name(), osName);
    return setter;
  }
}
