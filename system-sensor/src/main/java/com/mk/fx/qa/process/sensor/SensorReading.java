package com.mk.fx.qa.process.sensor;

/**
 * One instantaneous host reading.
 *
 * @param cpuPercent system-wide CPU utilisation, 0..100
 * @param memoryPercent physical memory in use, 0..100
 * @param diskPercent used space on the sampled file store, 0..100
 * @param networkBytes cumulative bytes sent plus received across all interfaces
 */
public record SensorReading(
        double cpuPercent, double memoryPercent, double diskPercent, long networkBytes) {

    public SensorReading {
        cpuPercent = clampPercent(cpuPercent);
        memoryPercent = clampPercent(memoryPercent);
        diskPercent = clampPercent(diskPercent);
        if (networkBytes < 0) {
            throw new IllegalArgumentException("networkBytes must be >= 0 but was " + networkBytes);
        }
    }

    private static double clampPercent(double value) {
        if (Double.isNaN(value) || value < 0) {
            return 0.0;
        }
        return Math.min(100.0, value);
    }
}
