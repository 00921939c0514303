package com.mk.fx.qa.process.sensor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads cumulative network byte counters from {@code /proc/net/dev}.
 *
 * <p>Hosts without procfs report zero; the sampler treats the value as a monotonic counter and
 * never as a rate.
 */
@Slf4j
public final class NetworkCounters {

    static final Path PROC_NET_DEV = Path.of("/proc/net/dev");

    private static final int RECEIVED_BYTES_COLUMN = 0;
    private static final int SENT_BYTES_COLUMN = 8;

    private final Path source;

    public NetworkCounters() {
        this(PROC_NET_DEV);
    }

    NetworkCounters(Path source) {
        this.source = source;
    }

    /**
     * Returns bytes sent plus received over every non-loopback interface.
     *
     * @throws SensorReadException if the counter file exists but cannot be read or parsed
     */
    public long totalBytes() throws SensorReadException {
        if (!Files.isReadable(source)) {
            log.debug("{} not readable, reporting 0 network bytes", source);
            return 0L;
        }
        try {
            return parse(Files.readAllLines(source));
        } catch (IOException e) {
            throw new SensorReadException("Cannot read " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Sums received and transmitted byte columns of a {@code /proc/net/dev} listing.
     *
     * @param lines raw file lines including the two header lines
     * @return total bytes across all interfaces except {@code lo}
     * @throws SensorReadException if an interface line is malformed
     */
    static long parse(List<String> lines) throws SensorReadException {
        long total = 0L;
        for (String line : lines) {
            int colon = line.indexOf(':');
            if (colon < 0) {
                continue; // header
            }
            String iface = line.substring(0, colon).trim();
            if (iface.equals("lo")) {
                continue;
            }
            String[] fields = line.substring(colon + 1).trim().split("\\s+");
            if (fields.length <= SENT_BYTES_COLUMN) {
                throw new SensorReadException("Malformed counters for interface " + iface);
            }
            try {
                total += Long.parseLong(fields[RECEIVED_BYTES_COLUMN]);
                total += Long.parseLong(fields[SENT_BYTES_COLUMN]);
            } catch (NumberFormatException e) {
                throw new SensorReadException("Non-numeric counters for interface " + iface, e);
            }
        }
        return total;
    }
}
