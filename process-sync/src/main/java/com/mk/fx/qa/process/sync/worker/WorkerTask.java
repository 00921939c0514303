package com.mk.fx.qa.process.sync.worker;

import static com.mk.fx.qa.process.sync.events.ProgressEvent.MAX_PROGRESS;

import com.mk.fx.qa.process.sync.coordination.WorkerEvents;
import com.mk.fx.qa.process.sync.coordination.WorkerSignals;
import com.mk.fx.qa.process.sync.events.LogEvent;
import com.mk.fx.qa.process.sync.events.ProgressEvent;
import com.mk.fx.qa.process.sync.events.StatusEvent;
import com.mk.fx.qa.process.sync.model.WorkType;
import com.mk.fx.qa.process.sync.model.WorkerState;
import com.mk.fx.qa.process.sync.priority.PrioritySetter;
import com.mk.fx.qa.process.sync.priority.PriorityUnsupportedException;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.random.RandomGenerator;
import lombok.extern.slf4j.Slf4j;

/**
 * One simulated worker. Runs on its own thread and drives itself through {@link WorkerState},
 * reporting every transition, each step of progress and a log line per unit of work through its
 * generation's {@link WorkerEvents}.
 *
 * <p>A worker that observes stop while running exits without a terminal event; the pool
 * controller records it as terminated. A worker stopped while paused reports {@link
 * WorkerState#TERMINATED} itself. Interruption, used by the controller to reclaim workers that
 * overstay the stop grace period, ends the task without further events.
 */
@Slf4j
public class WorkerTask implements Runnable {

  private final int id;
  private final WorkerSettings settings;
  private final WorkerSignals signals;
  private final WorkerEvents events;
  private final PrioritySetter prioritySetter;
  private final RandomGenerator random;

  private volatile WorkerState state = WorkerState.STARTING;
  private volatile int progress;
  private volatile Instant startTime;
  private volatile Instant endTime;
  private volatile Duration duration;

  public WorkerTask(
      int id,
      WorkerSettings settings,
      WorkerSignals signals,
      WorkerEvents events,
      PrioritySetter prioritySetter,
      RandomGenerator random) {
    this.id = id;
    this.settings = Objects.requireNonNull(settings, "settings");
    this.signals = Objects.requireNonNull(signals, "signals");
    this.events = Objects.requireNonNull(events, "events");
    this.prioritySetter = Objects.requireNonNull(prioritySetter, "prioritySetter");
    this.random = Objects.requireNonNull(random, "random");
  }

  @Override
  public void run() {
    startTime = Instant.now();
    long startNanos = System.nanoTime();
    try {
      transitionTo(WorkerState.RUNNING);
      emitLog(
          "Worker %d started (Priority: %s, Speed: %s)",
          id, settings.priority().label(), settings.speed().label());
      applyPriority();

      Duration stepDelay = settings.stepDelay();
      while (progress < MAX_PROGRESS && !signals.isStopRequested()) {
        if (signals.isPauseRequested()) {
          transitionTo(WorkerState.PAUSED);
          emitLog("Worker %d paused", id);
          if (signals.awaitResumeOrStop(settings.pausePollInterval())) {
            transitionTo(WorkerState.TERMINATED);
            emitLog("Worker %d terminated while paused", id);
            return;
          }
          transitionTo(WorkerState.RUNNING);
          emitLog("Worker %d resumed", id);
          continue;
        }

        WorkType kind = WorkType.random(random);
        kind.perform();
        emitLog("Worker %d performing %s work", id, kind.label());

        // step delay, cut short by pause or stop
        signals.awaitPauseOrStop(stepDelay);
        int next = progress + 1;
        if (next == MAX_PROGRESS) {
          // state reaches COMPLETED before progress reaches 100
          duration = Duration.ofNanos(System.nanoTime() - startNanos);
          moveTo(WorkerState.COMPLETED);
        }
        progress = next;
        events.publishProgress(new ProgressEvent(id, next));
      }

      endTime = Instant.now();
      if (state != WorkerState.COMPLETED) {
        log.debug("Worker {} observed stop at progress {}", id, progress);
        return;
      }
      events.publishStatus(StatusEvent.completed(id, settings.priority(), duration));
      emitLog(
          "Worker %d completed in %s seconds",
          id, String.format(Locale.ROOT, "%.2f", duration.toNanos() / 1_000_000_000.0));
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      endTime = Instant.now();
      log.debug("Worker {} interrupted in state {} at progress {}", id, state, progress);
    }
  }

  private void applyPriority() {
    try {
      prioritySetter.apply(settings.priority());
    } catch (PriorityUnsupportedException ex) {
      log.warn("Worker {} priority {} not applied: {}", id, ex.getLevel(), ex.getMessage());
      emitLog("Worker %d priority setting failed: %s", id, ex.getMessage());
    }
  }

  private void transitionTo(WorkerState next) {
    moveTo(next);
    events.publishStatus(StatusEvent.of(id, next, settings.priority()));
  }

  private void moveTo(WorkerState next) {
    if (!state.canTransitionTo(next)) {
      throw new IllegalStateException(
          "Worker " + id + " cannot move from " + state + " to " + next);
    }
    state = next;
  }

  private void emitLog(String format, Object... args) {
    events.publishLog(LogEvent.now(String.format(Locale.ROOT, format, args)));
  }

  public int getId() {
    return id;
  }

  public WorkerState getState() {
    return state;
  }

  public int getProgress() {
    return progress;
  }

  public Optional<Instant> getStartTime() {
    return Optional.ofNullable(startTime);
  }

  public Optional<Instant> getEndTime() {
    return Optional.ofNullable(endTime);
  }

  public Optional<Duration> getDuration() {
    return Optional.ofNullable(duration);
  }
}
