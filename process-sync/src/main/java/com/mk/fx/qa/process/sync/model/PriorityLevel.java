package com.mk.fx.qa.process.sync.model;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Abstract scheduling priority requested for workers. Each level carries the POSIX niceness and
 * the Java thread priority it maps to.
 */
public enum PriorityLevel {
  LOW("Low", 19, Thread.MIN_PRIORITY),
  NORMAL("Normal", 10, Thread.NORM_PRIORITY),
  HIGH("High", 0, Thread.MAX_PRIORITY);

  private final String label;
  private final int niceness;
  private final int threadPriority;

  PriorityLevel(String label, int niceness, int threadPriority) {
    this.label = label;
    this.niceness = niceness;
    this.threadPriority = threadPriority;
  }

  public String label() {
    return label;
  }

  public int niceness() {
    return niceness;
  }

  public int threadPriority() {
    return threadPriority;
  }

  public static PriorityLevel fromValue(String value) {
    return Arrays.stream(values())
        .filter(level -> level.name().equalsIgnoreCase(value == null ? "" : value.trim()))
        .findFirst()
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "Unsupported priority: " + value + ". Allowed: " + asStrings()));
  }

  public static Set<String> asStrings() {
    return Arrays.stream(values()).map(Enum::name).collect(Collectors.toUnmodifiableSet());
  }
}
