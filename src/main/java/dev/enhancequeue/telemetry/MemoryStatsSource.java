package dev.enhancequeue.telemetry;

/**
 * Queries total/free physical memory. Implementations may throw any runtime exception
 * when the platform refuses the query; callers keep their previous reading in that case.
 */
@FunctionalInterface
public interface MemoryStatsSource {
    MemoryStats query();
}
