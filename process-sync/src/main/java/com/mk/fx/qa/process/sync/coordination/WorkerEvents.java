package com.mk.fx.qa.process.sync.coordination;

import com.mk.fx.qa.process.sync.events.LogEvent;
import com.mk.fx.qa.process.sync.events.ProgressEvent;
import com.mk.fx.qa.process.sync.events.StatusEvent;

/** Publish-only view of a generation's event channels, as handed to workers. */
public interface WorkerEvents {

  void publishStatus(StatusEvent event);

  void publishProgress(ProgressEvent event);

  void publishLog(LogEvent event);
}
