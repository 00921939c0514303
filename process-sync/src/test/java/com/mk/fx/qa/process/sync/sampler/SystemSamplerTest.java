package com.mk.fx.qa.process.sync.sampler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.when;

import com.mk.fx.qa.process.sensor.SensorReadException;
import com.mk.fx.qa.process.sensor.SensorReading;
import com.mk.fx.qa.process.sensor.SystemSensor;
import com.mk.fx.qa.process.sync.cfg.SamplerCfg;
import com.mk.fx.qa.process.sync.sink.LogEntry;
import com.mk.fx.qa.process.sync.sink.LogSink;
import com.mk.fx.qa.process.sync.sink.SampleSink;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SystemSamplerTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  @Mock private SystemSensor sensor;

  private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
  private SamplerCfg cfg;
  private SampleSink sampleSink;
  private LogSink logSink;
  private SystemSampler sampler;

  @BeforeEach
  void setUp() {
    cfg = new SamplerCfg();
    cfg.setInterval(Duration.ofMillis(20));
    sampleSink = new SampleSink(10);
    logSink = new LogSink(100, clock);
  }

  @AfterEach
  void tearDown() {
    if (sampler != null) {
      sampler.stop();
    }
  }

  @Test
  void publishesReadingAsSample() throws Exception {
    when(sensor.read()).thenReturn(new SensorReading(12.5, 40, 70, 4_096));
    sampler = new SystemSampler(sensor, sampleSink, logSink, cfg, clock, () -> 0.99);

    sampler.sampleOnce();

    assertThat(sampleSink.latest())
        .hasValueSatisfying(
            sample -> {
              assertThat(sample.cpuPercent()).isEqualTo(12.5);
              assertThat(sample.networkBytes()).isEqualTo(4_096L);
              assertThat(sample.timestamp()).isEqualTo(NOW);
            });
    assertThat(logSink.size()).isZero();
  }

  @Test
  void occasionallyWritesSummaryLine() throws Exception {
    when(sensor.read()).thenReturn(new SensorReading(12.5, 40, 70.25, 0));
    sampler = new SystemSampler(sensor, sampleSink, logSink, cfg, clock, () -> 0.05);

    sampler.sampleOnce();

    assertThat(logSink.entries())
        .extracting(LogEntry::message)
        .containsExactly("System Stats - CPU: 12.5%, Memory: 40.0%, Disk: 70.3%");
  }

  @Test
  void failedReadIsLoggedAndSamplingContinues() throws Exception {
    when(sensor.read())
        .thenThrow(new SensorReadException("disk gone"))
        .thenReturn(new SensorReading(1, 2, 3, 4));
    sampler = new SystemSampler(sensor, sampleSink, logSink, cfg, clock, () -> 0.99);

    sampler.sampleOnce();
    sampler.sampleOnce();

    assertThat(sampler.failureCount()).isEqualTo(1);
    assertThat(logSink.entries())
        .extracting(LogEntry::message)
        .containsExactly("System Monitor Error: disk gone");
    assertThat(sampleSink.history()).hasSize(1);
  }

  @Test
  void scheduledSamplingFillsHistory() throws Exception {
    when(sensor.read()).thenReturn(new SensorReading(1, 2, 3, 4));
    sampler = new SystemSampler(sensor, sampleSink, logSink, cfg, clock, () -> 0.99);

    sampler.start();

    assertThat(sampler.isRunning()).isTrue();
    await().atMost(Duration.ofSeconds(2)).until(() -> sampleSink.history().size() >= 3);
    sampler.stop();
    assertThat(sampler.isRunning()).isFalse();
  }

  @Test
  void disabledSamplerNeverStarts() {
    cfg.setEnabled(false);
    sampler = new SystemSampler(sensor, sampleSink, logSink, cfg, clock, () -> 0.99);

    sampler.start();

    assertThat(sampler.isRunning()).isFalse();
  }
}
