package com.mk.fx.qa.process.sync.coordination;

import java.time.Duration;

/** Read-and-wait view of a generation's pause and stop flags, as handed to workers. */
public interface WorkerSignals {

  boolean isPauseRequested();

  boolean isStopRequested();

  /**
   * Blocks while pause is requested and stop is not, waking at least once per {@code
   * pollInterval} to re-check stop.
   *
   * @return {@code true} if stop was requested, {@code false} if pause was lifted
   * @throws InterruptedException if the waiting thread is interrupted
   */
  boolean awaitResumeOrStop(Duration pollInterval) throws InterruptedException;

  /**
   * Waits up to {@code timeout}, returning early once pause or stop is requested.
   *
   * @return {@code true} if either flag is raised
   * @throws InterruptedException if the waiting thread is interrupted
   */
  boolean awaitPauseOrStop(Duration timeout) throws InterruptedException;
}
