package com.mk.fx.qa.process.sync.dto;

import com.mk.fx.qa.process.sync.model.PriorityLevel;
import com.mk.fx.qa.process.sync.model.WorkerState;
import java.util.Map;

/** Pool-level status: generation, run and pause flags, and worker counts per state. */
public record PoolStatusResponse(
    long generation,
    boolean running,
    boolean paused,
    int workerCount,
    String speed,
    PriorityLevel priority,
    Map<WorkerState, Long> stateCounts) {}
