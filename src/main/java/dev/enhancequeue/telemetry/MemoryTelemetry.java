package dev.enhancequeue.telemetry;

import dev.enhancequeue.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tracks system memory pressure and exposes the last computed {@link MemorySnapshot}.
 *
 * <p>Two inputs feed the classification:
 * <ul>
 *   <li>a periodic poll of a {@link MemoryStatsSource}, which derives the level from the usage ratio</li>
 *   <li>optional {@link MemoryPressureEvents}, whose WARNING/CRITICAL reports are adopted immediately</li>
 * </ul>
 *
 * <p>A level pushed by the platform is held against downgrade for exactly one poll: the refresh that
 * follows the event can only escalate. The refresh after that re-derives freely, so a platform
 * CRITICAL is cleared once usage says otherwise.
 *
 * <p><strong>Thread Safety:</strong> readers never block; {@link #current()} and
 * {@link #shouldThrottle()} read a volatile snapshot. Updates are serialized on an internal lock,
 * listeners are invoked outside it.
 */
public class MemoryTelemetry implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(MemoryTelemetry.class);

    private final MemoryStatsSource source;
    private final MemoryPressureEvents platformEvents;
    private final EngineConfig config;
    private final List<PressureListener> listeners = new CopyOnWriteArrayList<>();
    private final Object updateLock = new Object();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile MemorySnapshot current = MemorySnapshot.INITIAL;
    private boolean platformHold;   // guarded by updateLock
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> pollTask;

    /**
     * @param source         physical memory query
     * @param platformEvents optional push channel, null when the platform has none
     * @param config         thresholds and refresh interval
     */
    public MemoryTelemetry(MemoryStatsSource source, MemoryPressureEvents platformEvents, EngineConfig config) {
        this.source = Objects.requireNonNull(source, "source cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.platformEvents = platformEvents;
        if (config.getRecoveryUsagePercent() > config.getWarningUsagePercent()
                || config.getWarningUsagePercent() > config.getCriticalUsagePercent()) {
            throw new IllegalArgumentException("usage thresholds must satisfy recovery <= warning <= critical");
        }
    }

    /**
     * Subscribes to platform events, takes a first reading and schedules the periodic refresh.
     * Calling it again is a no-op.
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Telemetry is closed");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        if (platformEvents != null) {
            platformEvents.subscribe(this::onPlatformEvent);
        }
        refresh();

        long interval = config.getTelemetryRefreshIntervalMillis();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "memory-telemetry");
            t.setDaemon(true);
            return t;
        });
        pollTask = scheduler.scheduleWithFixedDelay(this::refreshQuietly, interval, interval, TimeUnit.MILLISECONDS);
        logger.info("Memory telemetry started (refresh every {} ms, platform events: {})",
                interval, platformEvents != null);
    }

    /**
     * Polls the stats source once and re-derives the classification. A failing query is
     * logged and leaves the previous snapshot in place.
     */
    public void refresh() {
        MemoryStats stats;
        try {
            stats = source.query();
        } catch (RuntimeException e) {
            logger.warn("Failed to query system memory, keeping last snapshot: {}", e.getMessage());
            return;
        }

        PressureLevel previous;
        MemorySnapshot next;
        synchronized (updateLock) {
            previous = current.level();
            MemorySnapshot reading = MemorySnapshot.of(previous, stats);
            PressureLevel derived = derive(previous, reading.usagePercent());
            if (platformHold) {
                derived = PressureLevel.max(previous, derived);
                platformHold = false;
            }
            next = reading.withLevel(derived);
            current = next;
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Memory refresh: {}", next);
        }
        if (previous != next.level()) {
            logTransition(previous, next, "usage");
            notifyListeners(previous, next);
        }
    }

    /**
     * Adopts a platform-reported level immediately. NORMAL reports are ignored; the platform
     * channel only escalates.
     */
    public void onPlatformEvent(PressureLevel level) {
        Objects.requireNonNull(level, "level cannot be null");
        if (level == PressureLevel.NORMAL) {
            return;
        }
        PressureLevel previous;
        MemorySnapshot next;
        synchronized (updateLock) {
            previous = current.level();
            next = current.withLevel(level);
            current = next;
            platformHold = true;
        }
        if (previous != level) {
            logTransition(previous, next, "platform event");
            notifyListeners(previous, next);
        }
    }

    private PressureLevel derive(PressureLevel currentLevel, double usage) {
        if (usage > config.getCriticalUsagePercent()) {
            return PressureLevel.CRITICAL;
        }
        if (usage > config.getWarningUsagePercent()) {
            return PressureLevel.WARNING;
        }
        if (usage < config.getRecoveryUsagePercent()) {
            return PressureLevel.NORMAL;
        }
        // hysteresis band: keep WARNING, step CRITICAL down to WARNING
        return currentLevel == PressureLevel.CRITICAL ? PressureLevel.WARNING : currentLevel;
    }

    private void refreshQuietly() {
        try {
            refresh();
        } catch (RuntimeException e) {
            logger.error("Unexpected failure during memory refresh: {}", e.getMessage(), e);
        }
    }

    private void logTransition(PressureLevel previous, MemorySnapshot next, String cause) {
        if (next.level() == PressureLevel.NORMAL) {
            logger.info("Memory pressure {} -> NORMAL ({}): {}", previous, cause, next);
        } else {
            logger.warn("Memory pressure {} -> {} ({}): {}", previous, next.level(), cause, next);
        }
    }

    private void notifyListeners(PressureLevel previous, MemorySnapshot next) {
        for (PressureListener listener : listeners) {
            try {
                listener.onPressureChanged(previous, next);
            } catch (RuntimeException e) {
                logger.warn("Pressure listener failed: {}", e.getMessage(), e);
            }
        }
    }

    public MemorySnapshot current() {
        return current;
    }

    public PressureLevel level() {
        return current.level();
    }

    /**
     * @return true iff the current classification is CRITICAL
     */
    public boolean shouldThrottle() {
        return current.level() == PressureLevel.CRITICAL;
    }

    public void addListener(PressureListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    public void removeListener(PressureListener listener) {
        listeners.remove(listener);
    }

    public boolean isStarted() {
        return started.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (pollTask != null) {
            pollTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        if (platformEvents != null) {
            try {
                platformEvents.close();
            } catch (Exception e) {
                logger.warn("Failed to close platform pressure events: {}", e.getMessage(), e);
            }
        }
        listeners.clear();
        logger.info("Memory telemetry stopped");
    }
}
