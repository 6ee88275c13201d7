package dev.enhancequeue.telemetry;

/**
 * Raw physical memory figures in bytes, as reported by a {@link MemoryStatsSource}.
 *
 * @param totalBytes     installed physical memory
 * @param availableBytes memory immediately available to new allocations
 * @param usedBytes      memory in use
 */
public record MemoryStats(long totalBytes, long availableBytes, long usedBytes) {
    public MemoryStats {
        if (totalBytes < 0 || availableBytes < 0 || usedBytes < 0) {
            throw new IllegalArgumentException("memory figures must be non-negative");
        }
    }

    public static MemoryStats ofTotalAndFree(long totalBytes, long freeBytes) {
        return new MemoryStats(totalBytes, freeBytes, Math.max(0, totalBytes - freeBytes));
    }
}
