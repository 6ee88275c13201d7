package dev.enhancequeue.telemetry;

import java.util.Locale;
import java.util.Objects;

/**
 * Last computed telemetry reading. Figures are in MB.
 */
public record MemorySnapshot(PressureLevel level, double usedMB, double availableMB, double totalMB) {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    public static final MemorySnapshot INITIAL = new MemorySnapshot(PressureLevel.NORMAL, 0, 0, 0);

    public MemorySnapshot {
        Objects.requireNonNull(level, "level cannot be null");
    }

    static MemorySnapshot of(PressureLevel level, MemoryStats stats) {
        return new MemorySnapshot(level,
                stats.usedBytes() / BYTES_PER_MB,
                stats.availableBytes() / BYTES_PER_MB,
                stats.totalBytes() / BYTES_PER_MB);
    }

    MemorySnapshot withLevel(PressureLevel newLevel) {
        return new MemorySnapshot(newLevel, usedMB, availableMB, totalMB);
    }

    /**
     * @return used memory as a percentage of total, or 0 when total is unknown
     */
    public double usagePercent() {
        return totalMB > 0 ? (usedMB / totalMB) * 100.0 : 0.0;
    }

    public static String formatSize(double mb) {
        if (mb < 1024) {
            return String.format(Locale.ROOT, "%.1f MB", mb);
        }
        return String.format(Locale.ROOT, "%.2f GB", mb / 1024.0);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s used=%s available=%s total=%s (%.1f%%)",
                level, formatSize(usedMB), formatSize(availableMB), formatSize(totalMB), usagePercent());
    }
}
