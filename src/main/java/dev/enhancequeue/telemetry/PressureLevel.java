package dev.enhancequeue.telemetry;

/**
 * System memory pressure classification, ordered by severity.
 */
public enum PressureLevel {
    NORMAL,
    WARNING,
    CRITICAL;

    public boolean isAtLeast(PressureLevel other) {
        return compareTo(other) >= 0;
    }

    static PressureLevel max(PressureLevel a, PressureLevel b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
