package com.mk.fx.qa.process.sensor;

/**
 * Source of instantaneous host resource readings.
 *
 * <p>Implementations are queried from a single sampling thread and need not be thread-safe.
 */
public interface SystemSensor {

    /**
     * Takes one reading.
     *
     * @return the current CPU, memory and disk utilisation plus cumulative network bytes
     * @throws SensorReadException if the host could not be queried
     */
    SensorReading read() throws SensorReadException;
}
