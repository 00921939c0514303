package com.mk.fx.qa.process.sync.pool;

import com.mk.fx.qa.process.sync.model.PriorityLevel;
import com.mk.fx.qa.process.sync.model.SpeedSetting;
import com.mk.fx.qa.process.sync.model.WorkerState;
import java.util.Map;

/**
 * Pool-level summary for the observer.
 *
 * @param generation id of the current (or last) generation, 0 before the first start
 * @param running whether any worker of the current generation is still live
 * @param paused whether the pause flag is raised
 * @param workerCount workers in the current generation
 * @param speed speed of the current generation, {@code null} before the first start
 * @param priority priority of the current generation, {@code null} before the first start
 * @param stateCounts number of workers per reconciled state
 */
public record PoolSnapshot(
    long generation,
    boolean running,
    boolean paused,
    int workerCount,
    SpeedSetting speed,
    PriorityLevel priority,
    Map<WorkerState, Long> stateCounts) {}
