package com.mk.fx.qa.process.sync.coordination;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The pause and stop flags of one pool generation.
 *
 * <p>Both flags are level-triggered and independent: stop may be set while pause is set. Reads are
 * lock-free. Every write happens under {@link #lock} and signals {@link #changed}, so paused
 * workers wake on the transition instead of polling; the timed wait in {@link
 * #awaitResumeOrStop(Duration)} bounds observation latency if a signal is missed. Running workers
 * spend their step delay in {@link #awaitPauseOrStop(Duration)}, so a raised flag cuts it short.
 */
public final class CoordinationSignals implements WorkerSignals {

  private final AtomicBoolean pause = new AtomicBoolean();
  private final AtomicBoolean stop = new AtomicBoolean();
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();

  @Override
  public boolean isPauseRequested() {
    return pause.get();
  }

  @Override
  public boolean isStopRequested() {
    return stop.get();
  }

  /**
   * Flips the pause flag.
   *
   * @return the new value of the flag
   */
  public boolean togglePause() {
    lock.lock();
    try {
      boolean paused = !pause.get();
      pause.set(paused);
      changed.signalAll();
      return paused;
    } finally {
      lock.unlock();
    }
  }

  public void setPause(boolean paused) {
    lock.lock();
    try {
      pause.set(paused);
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  public void requestStop() {
    lock.lock();
    try {
      stop.set(true);
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean awaitResumeOrStop(Duration pollInterval) throws InterruptedException {
    long pollNanos = Math.max(1L, pollInterval.toNanos());
    lock.lockInterruptibly();
    try {
      while (pause.get() && !stop.get()) {
        changed.await(pollNanos, TimeUnit.NANOSECONDS);
      }
      return stop.get();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean awaitPauseOrStop(Duration timeout) throws InterruptedException {
    long remaining = timeout.toNanos();
    if (remaining <= 0) {
      return pause.get() || stop.get();
    }
    lock.lockInterruptibly();
    try {
      while (!pause.get() && !stop.get() && remaining > 0) {
        remaining = changed.awaitNanos(remaining);
      }
      return pause.get() || stop.get();
    } finally {
      lock.unlock();
    }
  }
}
