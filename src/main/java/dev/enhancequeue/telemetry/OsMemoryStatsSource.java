package dev.enhancequeue.telemetry;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * Reads physical memory from the platform {@code OperatingSystemMXBean}.
 */
public final class OsMemoryStatsSource implements MemoryStatsSource {

    private final OperatingSystemMXBean os;

    public OsMemoryStatsSource() {
        this(ManagementFactory.getOperatingSystemMXBean());
    }

    OsMemoryStatsSource(OperatingSystemMXBean os) {
        this.os = os;
    }

    @Override
    public MemoryStats query() {
        if (!(os instanceof com.sun.management.OperatingSystemMXBean)) {
            throw new UnsupportedOperationException(
                    "Physical memory figures not exposed by " + os.getClass().getName());
        }
        com.sun.management.OperatingSystemMXBean sun = (com.sun.management.OperatingSystemMXBean) os;
        return MemoryStats.ofTotalAndFree(sun.getTotalMemorySize(), sun.getFreeMemorySize());
    }
}
