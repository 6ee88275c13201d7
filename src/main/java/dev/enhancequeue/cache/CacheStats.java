package dev.enhancequeue.cache;

/**
 * Point-in-time cache figures. Disk figures are -1 when the disk tier is disabled.
 */
public record CacheStats(int memoryItems, long memoryBytes, long diskEntries, long diskBytes,
                         long hits, long misses) {
}
