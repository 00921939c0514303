package com.mk.fx.qa.process.sensor;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link SystemSensor} backed by the platform {@code OperatingSystemMXBean}, the file store
 * holding a configured path and {@link NetworkCounters}.
 */
@Slf4j
public class JmxSystemSensor implements SystemSensor {

    private final com.sun.management.OperatingSystemMXBean osBean;
    private final Path diskPath;
    private final NetworkCounters networkCounters;

    /**
     * Creates a sensor sampling disk usage of the file store that holds {@code diskPath}.
     *
     * @param diskPath any path on the file store to report
     * @throws IllegalStateException if the running JVM does not expose the extended OS bean
     */
    public JmxSystemSensor(Path diskPath) {
        this(diskPath, new NetworkCounters());
    }

    JmxSystemSensor(Path diskPath, NetworkCounters networkCounters) {
        this.diskPath = Objects.requireNonNull(diskPath, "diskPath");
        this.networkCounters = Objects.requireNonNull(networkCounters, "networkCounters");
        var bean = ManagementFactory.getOperatingSystemMXBean();
        if (!(bean instanceof com.sun.management.OperatingSystemMXBean extended)) {
            throw new IllegalStateException(
                    "Extended OperatingSystemMXBean not available on " + bean.getClass().getName());
        }
        this.osBean = extended;
        log.info("JmxSystemSensor initialised (disk path {})", diskPath);
    }

    @Override
    public SensorReading read() throws SensorReadException {
        double cpu = osBean.getCpuLoad() * 100.0;

        long totalMemory = osBean.getTotalMemorySize();
        long freeMemory = osBean.getFreeMemorySize();
        double memory = totalMemory <= 0 ? 0.0 : (totalMemory - freeMemory) * 100.0 / totalMemory;

        return new SensorReading(cpu, memory, diskPercent(), networkCounters.totalBytes());
    }

    private double diskPercent() throws SensorReadException {
        try {
            FileStore store = Files.getFileStore(diskPath);
            long total = store.getTotalSpace();
            if (total <= 0) {
                return 0.0;
            }
            return (total - store.getUnallocatedSpace()) * 100.0 / total;
        } catch (IOException e) {
            throw new SensorReadException(
                    "Cannot read file store for " + diskPath + ": " + e.getMessage(), e);
        }
    }
}
