package com.mk.fx.qa.process.sync.cfg;

import com.mk.fx.qa.process.sensor.JmxSystemSensor;
import com.mk.fx.qa.process.sensor.SystemSensor;
import com.mk.fx.qa.process.sync.priority.PrioritySetter;
import com.mk.fx.qa.process.sync.priority.PrioritySetters;
import com.mk.fx.qa.process.sync.sink.LogSink;
import com.mk.fx.qa.process.sync.sink.SampleSink;
import java.nio.file.Path;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the host-facing collaborators and the observer sinks. */
@Configuration
public class ObserverCfg {

  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }

  @Bean
  public LogSink logSink(PoolCfg poolCfg, Clock clock) {
    return new LogSink(poolCfg.getLogCapacity(), clock);
  }

  @Bean
  public SampleSink sampleSink(SamplerCfg samplerCfg) {
    return new SampleSink(samplerCfg.getHistorySize());
  }

  @Bean
  public PrioritySetter prioritySetter() {
    return PrioritySetters.forCurrentPlatform();
  }

  @Bean
  public SystemSensor systemSensor(SamplerCfg samplerCfg) {
    return new JmxSystemSensor(Path.of(samplerCfg.getDiskPath()));
  }
}
