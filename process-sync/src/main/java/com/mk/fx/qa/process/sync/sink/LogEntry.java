package com.mk.fx.qa.process.sync.sink;

import java.time.Instant;

/**
 * One line of the observer log.
 *
 * @param timestamp when the line was produced
 * @param message raw message
 * @param line rendered form {@code [HH:mm:ss.SSS] message}
 */
public record LogEntry(Instant timestamp, String message, String line) {}
