package com.mk.fx.qa.process.sync.pool;

import com.mk.fx.qa.process.sync.model.PriorityLevel;
import com.mk.fx.qa.process.sync.model.SpeedSetting;
import com.mk.fx.qa.process.sync.model.WorkerState;
import java.time.Duration;

/**
 * Immutable row of the reconciled worker table.
 *
 * @param id worker id within the generation
 * @param state last reconciled state
 * @param progress last reconciled progress, 0..100
 * @param speed configured speed
 * @param priority configured priority
 * @param duration run time, present only once {@link WorkerState#COMPLETED}
 */
public record WorkerView(
    int id,
    WorkerState state,
    int progress,
    SpeedSetting speed,
    PriorityLevel priority,
    Duration duration) {}
