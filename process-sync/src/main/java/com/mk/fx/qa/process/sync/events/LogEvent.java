package com.mk.fx.qa.process.sync.events;

import java.time.Instant;
import java.util.Objects;

/**
 * A free-form log line. Producers normally stamp it at emission; a {@code null} timestamp is
 * filled in when the line is reconciled into the log sink.
 */
public record LogEvent(String text, Instant timestamp) {

  public LogEvent {
    Objects.requireNonNull(text, "text");
  }

  public static LogEvent now(String text) {
    return new LogEvent(text, Instant.now());
  }

  public static LogEvent unstamped(String text) {
    return new LogEvent(text, null);
  }

  public LogEvent stampedIfAbsent(Instant fallback) {
    return timestamp != null ? this : new LogEvent(text, fallback);
  }
}
