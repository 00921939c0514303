package com.mk.fx.qa.process.sensor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NetworkCountersTest {

    private static final List<String> SAMPLE = List.of(
            "Inter-|   Receive                                                |  Transmit",
            " face |bytes    packets errs drop fifo frame compressed multicast|bytes    packets errs drop fifo colls carrier compressed",
            "    lo: 5000      50    0    0    0     0          0         0     5000      50    0    0    0     0       0          0",
            "  eth0: 1200      10    0    0    0     0          0         0      800       8    0    0    0     0       0          0",
            " wlan0:  300       3    0    0    0     0          0         0      200       2    0    0    0     0       0          0");

    @Test
    void parse_sumsReceivedAndSentBytes_excludingLoopback() throws Exception {
        assertThat(NetworkCounters.parse(SAMPLE)).isEqualTo(1200 + 800 + 300 + 200);
    }

    @Test
    void parse_malformedInterfaceLine_throws() {
        var lines = List.of("  eth0: 1200 10 0");

        assertThatThrownBy(() -> NetworkCounters.parse(lines))
                .isInstanceOf(SensorReadException.class)
                .hasMessageContaining("eth0");
    }

    @Test
    void parse_nonNumericCounter_throws() {
        var lines = List.of("  eth0: abc 10 0 0 0 0 0 0 800 8 0 0 0 0 0 0");

        assertThatThrownBy(() -> NetworkCounters.parse(lines))
                .isInstanceOf(SensorReadException.class)
                .hasCauseInstanceOf(NumberFormatException.class);
    }

    @Test
    void totalBytes_missingSource_reportsZero(@TempDir Path dir) throws Exception {
        var counters = new NetworkCounters(dir.resolve("absent"));

        assertThat(counters.totalBytes()).isZero();
    }

    @Test
    void totalBytes_readsFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("dev");
        Files.write(file, SAMPLE);

        assertThat(new NetworkCounters(file).totalBytes()).isEqualTo(2500);
    }
}
