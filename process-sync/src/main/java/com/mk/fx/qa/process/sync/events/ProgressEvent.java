package com.mk.fx.qa.process.sync.events;

/**
 * Progress reported by a worker after a step of work.
 *
 * @param workerId id of the emitting worker within its generation
 * @param progress completed steps, 0..100
 */
public record ProgressEvent(int workerId, int progress) {

  public static final int MAX_PROGRESS = 100;

  public ProgressEvent {
    if (progress < 0 || progress > MAX_PROGRESS) {
      throw new IllegalArgumentException("progress must be within [0,100] but was " + progress);
    }
  }
}
