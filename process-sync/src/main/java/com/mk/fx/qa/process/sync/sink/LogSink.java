package com.mk.fx.qa.process.sync.sink;

import com.mk.fx.qa.process.sync.events.LogEvent;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Ordered, bounded, timestamped text log shown to the observer. Oldest lines are evicted once
 * {@code capacity} is reached. Every line is mirrored to the application log at DEBUG.
 */
@Slf4j
public class LogSink {

  private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

  private final int capacity;
  private final Clock clock;
  private final Deque<LogEntry> entries = new ArrayDeque<>();

  public LogSink(int capacity, Clock clock) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be positive but was " + capacity);
    }
    this.capacity = capacity;
    this.clock = clock;
  }

  public void append(String message) {
    append(LogEvent.unstamped(message));
  }

  /** Appends an event, stamping it with the current time if its producer did not. */
  public void append(LogEvent event) {
    var stamped = event.stampedIfAbsent(clock.instant());
    var rendered =
        "[" + TIME_FORMAT.format(stamped.timestamp().atZone(clock.getZone())) + "] " + stamped.text();
    var entry = new LogEntry(stamped.timestamp(), stamped.text(), rendered);
    synchronized (entries) {
      entries.addLast(entry);
      while (entries.size() > capacity) {
        entries.pollFirst();
      }
    }
    log.debug(rendered);
  }

  /** Returns all retained lines, oldest first. */
  public List<LogEntry> entries() {
    synchronized (entries) {
      return List.copyOf(entries);
    }
  }

  /** Returns at most the {@code limit} most recent lines, oldest first. */
  public List<LogEntry> tail(int limit) {
    synchronized (entries) {
      List<LogEntry> all = new ArrayList<>(entries);
      return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
    }
  }

  public int size() {
    synchronized (entries) {
      return entries.size();
    }
  }

  /** Drops every line, then records that the log was cleared. */
  public void clear() {
    synchronized (entries) {
      entries.clear();
    }
    append("Log cleared");
  }
}
