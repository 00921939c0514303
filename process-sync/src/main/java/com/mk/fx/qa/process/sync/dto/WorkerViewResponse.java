package com.mk.fx.qa.process.sync.dto;

import com.mk.fx.qa.process.sync.model.PriorityLevel;
import com.mk.fx.qa.process.sync.model.WorkerState;

/** One row of the worker table. {@code durationSeconds} is only present once completed. */
public record WorkerViewResponse(
    int id,
    WorkerState state,
    int progress,
    String speed,
    PriorityLevel priority,
    Double durationSeconds) {}
