package com.mk.fx.qa.process.sync.events;

import com.mk.fx.qa.process.sensor.SensorReading;
import java.time.Instant;

/**
 * One host resource sample as delivered to the observer.
 *
 * @param cpuPercent CPU utilisation, 0..100
 * @param memoryPercent memory utilisation, 0..100
 * @param diskPercent disk utilisation, 0..100
 * @param networkBytes cumulative bytes sent plus received
 * @param timestamp when the sample was taken
 */
public record SampleEvent(
    double cpuPercent,
    double memoryPercent,
    double diskPercent,
    long networkBytes,
    Instant timestamp) {

  public static SampleEvent from(SensorReading reading, Instant timestamp) {
    return new SampleEvent(
        reading.cpuPercent(),
        reading.memoryPercent(),
        reading.diskPercent(),
        reading.networkBytes(),
        timestamp);
  }
}
