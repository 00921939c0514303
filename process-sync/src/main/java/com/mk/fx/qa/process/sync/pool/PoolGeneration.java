package com.mk.fx.qa.process.sync.pool;

import com.mk.fx.qa.process.sync.coordination.CoordinationSignals;
import com.mk.fx.qa.process.sync.coordination.EventChannels;
import com.mk.fx.qa.process.sync.priority.PrioritySetter;
import com.mk.fx.qa.process.sync.worker.WorkerSettings;
import com.mk.fx.qa.process.sync.worker.WorkerTask;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Everything one Start-to-Stop lifetime of the pool owns: its signals, its channels and its worker
 * threads. A generation is never reused; workers only receive its signals and channels through the
 * narrow {@code WorkerSignals} and {@code WorkerEvents} views.
 *
 * <p>Threading: a fixed pool of daemon platform threads, one per worker, so every worker runs in
 * parallel and scheduling priority hints apply per thread.
 */
@Slf4j
final class PoolGeneration {

  private final long number;
  private final int workerCount;
  private final WorkerSettings settings;
  private final CoordinationSignals signals = new CoordinationSignals();
  private final EventChannels channels = new EventChannels();
  private final ExecutorService executor;
  private final List<Future<?>> futures = new ArrayList<>();

  private volatile boolean stopped;
  private volatile boolean finished;

  PoolGeneration(long number, int workerCount, WorkerSettings settings) {
    this.number = number;
    this.workerCount = workerCount;
    this.settings = settings;
    this.executor = Executors.newFixedThreadPool(workerCount, threadFactory(number));
  }

  /**
   * Names threads {@code pool-worker-g<generation>-<n>}. The fixed pool creates one thread per
   * submitted task, in submission order, so {@code n} is the id of the worker the thread runs.
   */
  private static ThreadFactory threadFactory(long generation) {
    AtomicInteger next = new AtomicInteger();
    return runnable -> {
      Thread thread =
          new Thread(runnable, "pool-worker-g" + generation + "-" + next.getAndIncrement());
      thread.setDaemon(true);
      return thread;
    };
  }

  /** Spawns one {@link WorkerTask} per id. */
  void launch(PrioritySetter prioritySetter) {
    for (int id = 0; id < workerCount; id++) {
      var task =
          new WorkerTask(id, settings, signals, channels, prioritySetter, new SplittableRandom());
      futures.add(executor.submit(task));
    }
    log.info("Generation {} launched {} workers ({})", number, workerCount, settings);
  }

  /**
   * Waits for every worker to exit, sharing one deadline across all of them.
   *
   * @return number of workers still running when the grace period ran out
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  int awaitExit(Duration gracePeriod) throws InterruptedException {
    long deadline = System.nanoTime() + gracePeriod.toNanos();
    int survivors = 0;
    for (Future<?> future : futures) {
      long remaining = Math.max(0L, deadline - System.nanoTime());
      try {
        future.get(remaining, TimeUnit.NANOSECONDS);
      } catch (TimeoutException timeout) {
        survivors++;
      } catch (ExecutionException failed) {
        log.warn(
            "Generation {} worker failed: {}", number, failed.getCause().getMessage(), failed.getCause());
      } catch (CancellationException cancelled) {
        log.debug("Generation {} worker future cancelled", number);
      }
    }
    return survivors;
  }

  /**
   * Interrupts every worker still running and waits up to {@code timeout} for the threads to end.
   *
   * @return {@code true} if every worker thread ended in time
   */
  boolean forceReclaim(Duration timeout) {
    executor.shutdownNow();
    try {
      boolean terminated = executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!terminated) {
        log.warn("Generation {} workers still alive {} after interrupt", number, timeout);
      }
      return terminated;
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /** Releases the worker threads once their tasks are done, without interrupting them. */
  void shutdown() {
    executor.shutdown();
  }

  long number() {
    return number;
  }

  int workerCount() {
    return workerCount;
  }

  WorkerSettings settings() {
    return settings;
  }

  CoordinationSignals signals() {
    return signals;
  }

  EventChannels channels() {
    return channels;
  }

  boolean isStopped() {
    return stopped;
  }

  void markStopped() {
    stopped = true;
  }

  boolean isFinished() {
    return finished;
  }

  void markFinished() {
    finished = true;
  }
}
