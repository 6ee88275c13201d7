package dev.enhancequeue.telemetry;

import java.util.function.Consumer;

/**
 * Optional push channel for platform memory pressure notifications. Only WARNING and
 * CRITICAL are ever delivered; clearing happens through periodic re-derivation.
 */
public interface MemoryPressureEvents extends AutoCloseable {

    void subscribe(Consumer<PressureLevel> sink);

    @Override
    default void close() { /* no-op by default */ }
}
