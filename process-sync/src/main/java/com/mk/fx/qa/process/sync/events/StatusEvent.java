package com.mk.fx.qa.process.sync.events;

import com.mk.fx.qa.process.sync.model.PriorityLevel;
import com.mk.fx.qa.process.sync.model.WorkerState;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * A worker's announcement that it entered {@code state}.
 *
 * @param workerId id of the emitting worker within its generation
 * @param state the state just entered
 * @param priority the worker's configured priority
 * @param duration wall-clock run time, present only for {@link WorkerState#COMPLETED}
 */
public record StatusEvent(int workerId, WorkerState state, PriorityLevel priority, Duration duration) {

  public StatusEvent {
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(priority, "priority");
    if (duration != null && state != WorkerState.COMPLETED) {
      throw new IllegalArgumentException("Duration is only reported for COMPLETED, not " + state);
    }
  }

  public static StatusEvent of(int workerId, WorkerState state, PriorityLevel priority) {
    return new StatusEvent(workerId, state, priority, null);
  }

  public static StatusEvent completed(int workerId, PriorityLevel priority, Duration duration) {
    return new StatusEvent(
        workerId, WorkerState.COMPLETED, priority, Objects.requireNonNull(duration, "duration"));
  }

  public Optional<Duration> durationValue() {
    return Optional.ofNullable(duration);
  }
}
