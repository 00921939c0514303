package com.mk.fx.qa.process.sync.dto;

import java.time.Instant;

/** One system resource sample. */
public record SampleResponse(
    double cpuPercent,
    double memoryPercent,
    double diskPercent,
    long networkBytes,
    Instant timestamp) {}
