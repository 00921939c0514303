package com.mk.fx.qa.process.sensor;

/** Raised when a {@link SystemSensor} cannot produce a reading. */
public class SensorReadException extends Exception {

    public SensorReadException(String message) {
        super(message);
    }

    public SensorReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
