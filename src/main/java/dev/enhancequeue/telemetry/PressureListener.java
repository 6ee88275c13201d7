package dev.enhancequeue.telemetry;

/**
 * Notified whenever the telemetry classification changes.
 */
@FunctionalInterface
public interface PressureListener {
    void onPressureChanged(PressureLevel previous, MemorySnapshot current);
}
