package com.mk.fx.qa.process.sync.sampler;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.process.sensor.SensorReadException;
import com.mk.fx.qa.process.sensor.SystemSensor;
import com.mk.fx.qa.process.sync.cfg.SamplerCfg;
import com.mk.fx.qa.process.sync.events.LogEvent;
import com.mk.fx.qa.process.sync.events.SampleEvent;
import com.mk.fx.qa.process.sync.sink.LogSink;
import com.mk.fx.qa.process.sync.sink.SampleSink;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.DoubleSupplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Samples host resources on its own thread, independently of the worker pool, and feeds the
 * observer's {@link SampleSink}. Roughly one tick in ten also writes a summary line to the {@link
 * LogSink}. A failed reading is logged and the next tick runs as scheduled.
 */
@Slf4j
@Component
public class SystemSampler {

  private final SystemSensor sensor;
  private final SampleSink sampleSink;
  private final LogSink logSink;
  private final SamplerCfg cfg;
  private final Clock clock;
  private final DoubleSupplier chance;
  private final AtomicLong failures = new AtomicLong();

  private ScheduledExecutorService scheduler;

  @Autowired
  public SystemSampler(
      SystemSensor sensor, SampleSink sampleSink, LogSink logSink, SamplerCfg cfg, Clock clock) {
    this(sensor, sampleSink, logSink, cfg, clock, () -> ThreadLocalRandom.current().nextDouble());
  }

  SystemSampler(
      SystemSensor sensor,
      SampleSink sampleSink,
      LogSink logSink,
      SamplerCfg cfg,
      Clock clock,
      DoubleSupplier chance) {
    this.sensor = sensor;
    this.sampleSink = sampleSink;
    this.logSink = logSink;
    this.cfg = cfg;
    this.clock = clock;
    this.chance = chance;
  }

  @PostConstruct
  public synchronized void start() {
    if (!cfg.isEnabled()) {
      log.info("System sampler disabled");
      return;
    }
    if (scheduler != null) {
      return;
    }
    scheduler =
        Executors.newSingleThreadScheduledExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, "system-sampler");
              thread.setDaemon(true);
              return thread;
            });
    long intervalMillis = cfg.getInterval().toMillis();
    scheduler.scheduleWithFixedDelay(this::sampleOnce, 0, intervalMillis, TimeUnit.MILLISECONDS);
    log.info("System sampler started - sampling every {} ms", intervalMillis);
  }

  /** Takes one reading and publishes it. Never throws. */
  @VisibleForTesting
  void sampleOnce() {
    try {
      var reading = sensor.read();
      var sample = SampleEvent.from(reading, clock.instant());
      sampleSink.accept(sample);
      if (chance.getAsDouble() < cfg.getLogProbability()) {
        logSink.append(
            LogEvent.now(
                String.format(
                    Locale.ROOT,
                    "System Stats - CPU: %.1f%%, Memory: %.1f%%, Disk: %.1f%%",
                    sample.cpuPercent(),
                    sample.memoryPercent(),
                    sample.diskPercent())));
      }
    } catch (SensorReadException | RuntimeException ex) {
      failures.incrementAndGet();
      log.warn("System sensor read failed: {}", ex.getMessage());
      logSink.append("System Monitor Error: " + ex.getMessage());
    }
  }

  /** Number of ticks that failed since startup. */
  public long failureCount() {
    return failures.get();
  }

  public synchronized boolean isRunning() {
    return scheduler != null && !scheduler.isShutdown();
  }

  @PreDestroy
  public synchronized void stop() {
    if (scheduler == null) {
      return;
    }
    scheduler.shutdownNow();
    scheduler = null;
    log.info("System sampler stopped");
  }
}
