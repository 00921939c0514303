package com.mk.fx.qa.process.sync.pool;

import static com.mk.fx.qa.process.sync.events.ProgressEvent.MAX_PROGRESS;

import com.mk.fx.qa.process.sync.events.StatusEvent;
import com.mk.fx.qa.process.sync.model.PriorityLevel;
import com.mk.fx.qa.process.sync.model.SpeedSetting;
import com.mk.fx.qa.process.sync.model.WorkerState;
import java.time.Duration;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Mutable, controller-side view of one worker. Not thread-safe: only touched under the
 * controller's view lock.
 *
 * <p>A record accepts exactly one terminal transition. Progress never decreases and shows 100 only
 * together with {@link WorkerState#COMPLETED}.
 */
@Slf4j
@Getter
final class WorkerViewRecord {

  private final int id;
  private final SpeedSetting speed;
  private final PriorityLevel priority;
  private WorkerState state = WorkerState.STARTING;
  private int progress;
  private Duration duration;
  private int terminalTransitions;

  WorkerViewRecord(int id, SpeedSetting speed, PriorityLevel priority) {
    this.id = id;
    this.speed = speed;
    this.priority = priority;
  }

  /**
   * Applies a reported state change.
   *
   * @return {@code true} if the record changed
   */
  boolean applyStatus(StatusEvent event) {
    WorkerState next = event.state();
    if (next == state) {
      return false;
    }
    if (!state.canTransitionTo(next)) {
      log.debug("Worker {} ignoring {} while {}", id, next, state);
      return false;
    }
    state = next;
    if (next == WorkerState.COMPLETED) {
      progress = MAX_PROGRESS;
      duration = event.duration();
    }
    if (next.isTerminal()) {
      terminalTransitions++;
    }
    return true;
  }

  /**
   * Applies reported progress. Ignored once terminal; held below 100 until the completion status
   * has been reconciled.
   */
  boolean applyProgress(int reported) {
    if (state.isTerminal()) {
      return false;
    }
    int capped = Math.min(reported, MAX_PROGRESS - 1);
    if (capped <= progress) {
      return false;
    }
    progress = capped;
    return true;
  }

  /**
   * Marks the worker terminated as part of a stop, unless it already reached a terminal state.
   *
   * @return {@code true} if the record moved to {@link WorkerState#TERMINATED}
   */
  boolean terminateUnlessFinished() {
    if (state.isTerminal()) {
      return false;
    }
    state = WorkerState.TERMINATED;
    terminalTransitions++;
    return true;
  }

  WorkerView toView() {
    return new WorkerView(id, state, progress, speed, priority, duration);
  }
}
