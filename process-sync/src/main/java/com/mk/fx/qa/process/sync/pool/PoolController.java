package com.mk.fx.qa.process.sync.pool;

import static com.google.common.base.Preconditions.checkArgument;
import static com.mk.fx.qa.process.sync.cfg.PoolCfg.MAX_WORKERS;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.process.sync.cfg.PoolCfg;
import com.mk.fx.qa.process.sync.events.ProgressEvent;
import com.mk.fx.qa.process.sync.events.StatusEvent;
import com.mk.fx.qa.process.sync.model.PriorityLevel;
import com.mk.fx.qa.process.sync.model.SpeedSetting;
import com.mk.fx.qa.process.sync.model.WorkerState;
import com.mk.fx.qa.process.sync.priority.PrioritySetter;
import com.mk.fx.qa.process.sync.sink.LogSink;
import com.mk.fx.qa.process.sync.worker.WorkerSettings;
import jakarta.annotation.PreDestroy;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Owns the worker pool: starts and stops generations, toggles pause, and reconciles worker events
 * into the per-worker view the observer reads.
 *
 * <p>Responsibilities:
 * - {@link #start} stops any live generation, then builds a fresh {@link PoolGeneration} (new
 *   signals, new channels, ids {@code 0..count-1}) and spawns its workers.
 * - {@link #togglePause} flips the pause flag without waiting for workers to acknowledge it.
 * - {@link #stop} raises stop, gives workers a shared grace period, interrupts survivors, and marks
 *   every worker not already {@code COMPLETED} as {@code TERMINATED} before closing the channels.
 * - {@link #reconcileTick} drains the channels without blocking and applies the events by id.
 *
 * <p>Thread-safety: {@code start} and {@code stop} are serialised by a lifecycle lock. The view
 * table has its own lock, held only for short non-blocking work, so reconcile ticks never wait out
 * a stop's grace period. A completion that has not been reconciled when stop takes the view lock
 * loses to stop; each record accepts a single terminal transition.
 */
@Slf4j
@Service
public class PoolController {

  private final PoolCfg cfg;
  private final PrioritySetter prioritySetter;
  private final LogSink logSink;
  private final ReentrantLock lifecycleLock = new ReentrantLock();
  private final Object viewLock = new Object();
  private final Map<Integer, WorkerViewRecord> view = new TreeMap<>();
  private final AtomicLong generationCounter = new AtomicLong();

  private volatile PoolGeneration current;

  public PoolController(PoolCfg cfg, PrioritySetter prioritySetter, LogSink logSink) {
    this.cfg = cfg;
    this.prioritySetter = prioritySetter;
    this.logSink = logSink;
    log.info(
        "PoolController initialised with baseDelay={} grace={} prioritySetter={}",
        cfg.getBaseDelay(),
        cfg.getStopGracePeriod(),
        prioritySetter.name());
  }

  /** Starts a pool described by {@code spec}. */
  public PoolSnapshot start(PoolLaunchSpec spec) {
    return start(spec.count(), spec.speed(), spec.priority());
  }

  /**
   * Starts a new generation of {@code count} workers, stopping the current one first.
   *
   * @param count number of workers, 1..32
   * @param speed speed multiplier for every worker
   * @param priority scheduling priority for every worker
   * @return snapshot taken right after the workers were spawned
   * @throws IllegalArgumentException if any argument is out of range or missing
   */
  public PoolSnapshot start(int count, SpeedSetting speed, PriorityLevel priority) {
    checkArgument(
        count >= 1 && count <= MAX_WORKERS,
        "Worker count must be within [1,%s] but was %s",
        MAX_WORKERS,
        count);
    checkArgument(speed != null, "Speed is required");
    checkArgument(priority != null, "Priority is required");

    lifecycleLock.lock();
    try {
      stopCurrent();

      var settings =
          new WorkerSettings(speed, priority, cfg.getBaseDelay(), cfg.getPausePollInterval());
      var generation = new PoolGeneration(generationCounter.incrementAndGet(), count, settings);
      synchronized (viewLock) {
        view.clear();
        for (int id = 0; id < count; id++) {
          view.put(id, new WorkerViewRecord(id, speed, priority));
        }
        current = generation;
      }
      generation.launch(prioritySetter);

      log.info("Started generation {} with {} workers", generation.number(), count);
      logSink.append(
          String.format(
              Locale.ROOT,
              "Started %d workers (Speed: %s, Priority: %s)",
              count,
              speed.label(),
              priority.label()));
      return snapshot();
    } finally {
      lifecycleLock.unlock();
    }
  }

  /**
   * Flips the pause flag of the live generation. Workers observe the change within the pause poll
   * interval; this call does not wait for them.
   *
   * @return {@code true} if the pool is now paused
   * @throws IllegalStateException if no generation is live (never started, stopped or finished)
   */
  public boolean togglePause() {
    var generation = current;
    if (generation == null || generation.isStopped() || generation.isFinished()) {
      throw new IllegalStateException("No worker pool is running");
    }
    boolean paused = generation.signals().togglePause();
    log.info("Generation {} {}", generation.number(), paused ? "paused" : "resumed");
    logSink.append(paused ? "All workers paused" : "All workers resumed");
    return paused;
  }

  /**
   * Stops the live generation. Returns once every worker has exited or been reclaimed; a no-op if
   * nothing is live.
   */
  public PoolSnapshot stop() {
    lifecycleLock.lock();
    try {
      stopCurrent();
      return snapshot();
    } finally {
      lifecycleLock.unlock();
    }
  }

  private void stopCurrent() {
    var generation = current;
    if (generation == null || generation.isStopped()) {
      return;
    }

    generation.signals().requestStop();
    logSink.append("Stopping all workers...");

    int survivors;
    try {
      survivors = generation.awaitExit(cfg.getStopGracePeriod());
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      survivors = generation.workerCount();
    }

    if (survivors > 0) {
      log.warn(
          "Generation {}: {} worker(s) still running after {}, forcing termination",
          generation.number(),
          survivors,
          cfg.getStopGracePeriod());
      generation.forceReclaim(cfg.getForcedStopTimeout());
      logSink.append(
          String.format(
              Locale.ROOT,
              "Forced termination of %d worker(s) after %d ms grace period",
              survivors,
              cfg.getStopGracePeriod().toMillis()));
    } else {
      generation.shutdown();
    }

    int terminated = 0;
    int discarded;
    synchronized (viewLock) {
      generation.markStopped();
      for (WorkerViewRecord record : view.values()) {
        if (record.terminateUnlessFinished()) {
          terminated++;
        }
      }
      discarded = generation.channels().closeAll();
      // stop stays raised so a worker that outlived forced reclaim still exits
      generation.signals().setPause(false);
    }
    log.info(
        "Generation {} stopped: {} worker(s) terminated, {} pending event(s) discarded",
        generation.number(),
        terminated,
        discarded);
    logSink.append("All workers stopped");
  }

  /**
   * Drains the live generation's status, progress and log channels and applies what they held.
   * Never waits for events. Events naming an id outside the generation are ignored.
   */
  public void reconcileTick() {
    var generation = current;
    if (generation == null) {
      return;
    }
    synchronized (viewLock) {
      if (generation != current || generation.isStopped()) {
        return;
      }
      var channels = generation.channels();
      channels.status().drain(this::applyStatus);
      channels.progress().drain(this::applyProgress);
      channels.log().drain(logSink::append);

      if (!generation.isFinished() && allTerminal()) {
        generation.markFinished();
        generation.shutdown();
        log.info("Generation {} finished", generation.number());
        logSink.append(
            String.format(Locale.ROOT, "All %d workers finished", generation.workerCount()));
      }
    }
  }

  private void applyStatus(StatusEvent event) {
    var record = view.get(event.workerId());
    if (record == null) {
      log.debug("Ignoring status for unknown worker {}", event.workerId());
      return;
    }
    record.applyStatus(event);
  }

  private void applyProgress(ProgressEvent event) {
    var record = view.get(event.workerId());
    if (record == null) {
      log.debug("Ignoring progress for unknown worker {}", event.workerId());
      return;
    }
    record.applyProgress(event.progress());
  }

  private boolean allTerminal() {
    return view.values().stream().allMatch(record -> record.getState().isTerminal());
  }

  /** Returns the reconciled worker table, ordered by id. */
  public List<WorkerView> workers() {
    synchronized (viewLock) {
      return view.values().stream().map(WorkerViewRecord::toView).toList();
    }
  }

  /** Returns the pool-level summary. */
  public PoolSnapshot snapshot() {
    synchronized (viewLock) {
      Map<WorkerState, Long> counts = new EnumMap<>(WorkerState.class);
      for (WorkerViewRecord record : view.values()) {
        counts.merge(record.getState(), 1L, Long::sum);
      }
      var generation = current;
      if (generation == null) {
        return new PoolSnapshot(0, false, false, 0, null, null, Collections.unmodifiableMap(counts));
      }
      boolean running = !generation.isStopped() && !allTerminal();
      return new PoolSnapshot(
          generation.number(),
          running,
          generation.signals().isPauseRequested(),
          generation.workerCount(),
          generation.settings().speed(),
          generation.settings().priority(),
          Collections.unmodifiableMap(counts));
    }
  }

  /** Returns the id of the current (or last) generation, 0 before the first start. */
  public long generation() {
    var generation = current;
    return generation == null ? 0 : generation.number();
  }

  /** Returns whether every channel of the current generation is empty. */
  public boolean channelsEmpty() {
    var generation = current;
    return generation == null || generation.channels().isEmpty();
  }

  @VisibleForTesting
  int terminalTransitions(int workerId) {
    synchronized (viewLock) {
      var record = view.get(workerId);
      return record == null ? 0 : record.getTerminalTransitions();
    }
  }

  @PreDestroy
  void onShutdown() {
    stop();
  }
}
