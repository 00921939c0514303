package com.mk.fx.qa.process.sync.pool;

import com.mk.fx.qa.process.sync.model.PriorityLevel;
import com.mk.fx.qa.process.sync.model.SpeedSetting;

/**
 * Parameters of a {@link PoolController#start} call.
 *
 * @param count number of workers, 1..32
 * @param speed speed multiplier
 * @param priority scheduling priority
 */
public record PoolLaunchSpec(int count, SpeedSetting speed, PriorityLevel priority) {}
