package com.mk.fx.qa.process.sync.worker;

import com.mk.fx.qa.process.sync.model.PriorityLevel;
import com.mk.fx.qa.process.sync.model.SpeedSetting;
import java.time.Duration;
import java.util.Objects;

/**
 * Per-generation settings shared by every worker.
 *
 * @param speed speed multiplier applied to {@code baseDelay}
 * @param priority requested scheduling priority
 * @param baseDelay per-step delay at 1x
 * @param pausePollInterval upper bound on how long a paused worker waits before re-checking stop
 */
public record WorkerSettings(
    SpeedSetting speed, PriorityLevel priority, Duration baseDelay, Duration pausePollInterval) {

  public WorkerSettings {
    Objects.requireNonNull(speed, "speed");
    Objects.requireNonNull(priority, "priority");
    Objects.requireNonNull(baseDelay, "baseDelay");
    Objects.requireNonNull(pausePollInterval, "pausePollInterval");
    if (baseDelay.isNegative()) {
      throw new IllegalArgumentException("baseDelay must not be negative");
    }
    if (pausePollInterval.isZero() || pausePollInterval.isNegative()) {
      throw new IllegalArgumentException("pausePollInterval must be positive");
    }
  }

  /** Delay after each step: {@code baseDelay / speed}. */
  public Duration stepDelay() {
    return Duration.ofNanos((long) (baseDelay.toNanos() / speed.multiplier()));
  }
}
