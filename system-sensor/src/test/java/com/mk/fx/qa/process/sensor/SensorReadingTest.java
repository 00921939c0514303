package com.mk.fx.qa.process.sensor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SensorReadingTest {

    @Test
    void percentages_areClampedIntoRange() {
        var reading = new SensorReading(-100.0, 150.0, Double.NaN, 0);

        assertThat(reading.cpuPercent()).isZero();
        assertThat(reading.memoryPercent()).isEqualTo(100.0);
        assertThat(reading.diskPercent()).isZero();
    }

    @Test
    void negativeNetworkBytes_rejected() {
        assertThatThrownBy(() -> new SensorReading(1, 1, 1, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
