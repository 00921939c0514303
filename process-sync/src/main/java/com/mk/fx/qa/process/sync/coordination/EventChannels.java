package com.mk.fx.qa.process.sync.coordination;

import com.mk.fx.qa.process.sync.events.LogEvent;
import com.mk.fx.qa.process.sync.events.ProgressEvent;
import com.mk.fx.qa.process.sync.events.StatusEvent;

/** The status, progress and log channels of one pool generation. */
public final class EventChannels implements WorkerEvents {

  private final EventChannel<StatusEvent> status = new EventChannel<>("status");
  private final EventChannel<ProgressEvent> progress = new EventChannel<>("progress");
  private final EventChannel<LogEvent> log = new EventChannel<>("log");

  public EventChannel<StatusEvent> status() {
    return status;
  }

  public EventChannel<ProgressEvent> progress() {
    return progress;
  }

  public EventChannel<LogEvent> log() {
    return log;
  }

  @Override
  public void publishStatus(StatusEvent event) {
    status.publish(event);
  }

  @Override
  public void publishProgress(ProgressEvent event) {
    progress.publish(event);
  }

  @Override
  public void publishLog(LogEvent event) {
    log.publish(event);
  }

  /**
   * Closes all three channels, dropping what they hold and anything a straggling worker publishes
   * later.
   *
   * @return total number of events dropped
   */
  public int closeAll() {
    return status.close() + progress.close() + log.close();
  }

  public boolean isEmpty() {
    return status.isEmpty() && progress.isEmpty() && log.isEmpty();
  }
}
