package com.mk.fx.qa.process.sync.cfg;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "process.pool")
public class PoolCfg {

  /** Upper bound on workers per generation. */
  public static final int MAX_WORKERS = 32;

  /** Per-step worker delay at 1x speed. */
  @NotNull private Duration baseDelay = Duration.ofMillis(50);

  /** Longest a paused worker waits before re-checking stop. */
  @NotNull private Duration pausePollInterval = Duration.ofMillis(100);

  /** Time workers get to exit on their own after stop. */
  @NotNull private Duration stopGracePeriod = Duration.ofSeconds(1);

  /** Time interrupted workers get to unwind once the grace period is over. */
  @NotNull private Duration forcedStopTimeout = Duration.ofSeconds(2);

  @Min(10)
  @Max(10_000)
  private long reconcileIntervalMs = 200;

  @Positive private int logCapacity = 5_000;
}
