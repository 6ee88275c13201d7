package dev.enhancequeue.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.management.ListenerNotFoundException;
import javax.management.Notification;
import javax.management.NotificationEmitter;
import javax.management.NotificationListener;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryNotificationInfo;
import java.lang.management.MemoryPoolMXBean;
import java.lang.management.MemoryType;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Pressure events sourced from JVM heap pool thresholds.
 *
 * <p>Every heap pool that supports thresholds is armed at two levels of its maximum size:
 * crossing the usage threshold is reported as {@link PressureLevel#WARNING}, still being
 * above the collection threshold after a GC is reported as {@link PressureLevel#CRITICAL}.
 */
public final class JvmMemoryPressureEvents implements MemoryPressureEvents, NotificationListener {
    private static final Logger logger = LoggerFactory.getLogger(JvmMemoryPressureEvents.class);

    private final List<Consumer<PressureLevel>> sinks = new CopyOnWriteArrayList<>();
    private final NotificationEmitter emitter;

    public JvmMemoryPressureEvents(double warningFraction, double criticalFraction) {
        this(ManagementFactory.getMemoryMXBean(), ManagementFactory.getMemoryPoolMXBeans(),
                warningFraction, criticalFraction);
    }

    JvmMemoryPressureEvents(MemoryMXBean memoryBean, List<MemoryPoolMXBean> pools,
                            double warningFraction, double criticalFraction) {
        if (warningFraction <= 0 || warningFraction > 1 || criticalFraction <= 0 || criticalFraction > 1) {
            throw new IllegalArgumentException("threshold fractions must be in (0, 1]");
        }
        Objects.requireNonNull(memoryBean, "memoryBean cannot be null");
        this.emitter = (NotificationEmitter) memoryBean;

        int armed = 0;
        for (MemoryPoolMXBean pool : pools) {
            if (pool.getType() != MemoryType.HEAP) continue;
            long max = pool.getUsage().getMax();
            if (max <= 0) continue;
            if (pool.isUsageThresholdSupported()) {
                pool.setUsageThreshold((long) (max * warningFraction));
                armed++;
            }
            if (pool.isCollectionUsageThresholdSupported()) {
                pool.setCollectionUsageThreshold((long) (max * criticalFraction));
            }
        }
        emitter.addNotificationListener(this, null, null);
        logger.info("Armed heap pressure thresholds on {} pools (warning={}, critical={})",
                armed, warningFraction, criticalFraction);
    }

    @Override
    public void subscribe(Consumer<PressureLevel> sink) {
        sinks.add(Objects.requireNonNull(sink, "sink cannot be null"));
    }

    @Override
    public void handleNotification(Notification notification, Object handback) {
        PressureLevel level;
        switch (notification.getType()) {
            case MemoryNotificationInfo.MEMORY_THRESHOLD_EXCEEDED:
                level = PressureLevel.WARNING;
                break;
            case MemoryNotificationInfo.MEMORY_COLLECTION_THRESHOLD_EXCEEDED:
                level = PressureLevel.CRITICAL;
                break;
            default:
                return;
        }
        for (Consumer<PressureLevel> sink : sinks) {
            try {
                sink.accept(level);
            } catch (RuntimeException e) {
                logger.warn("Pressure sink failed on {}: {}", level, e.getMessage(), e);
            }
        }
    }

    @Override
    public void close() {
        sinks.clear();
        try {
            emitter.removeNotificationListener(this);
        } catch (ListenerNotFoundException e) {
            logger.debug("Heap pressure listener already detached");
        }
    }
}
