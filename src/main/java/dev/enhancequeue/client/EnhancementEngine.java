package dev.enhancequeue.client;

import dev.enhancequeue.api.BatchQueue;
import dev.enhancequeue.api.Enhancer;
import dev.enhancequeue.api.ImageStorage;
import dev.enhancequeue.cache.ArtifactCache;
import dev.enhancequeue.cache.RocksDiskTier;
import dev.enhancequeue.config.EngineConfig;
import dev.enhancequeue.core.EnhancementBatchQueue;
import dev.enhancequeue.history.HistoryStack;
import dev.enhancequeue.telemetry.JvmMemoryPressureEvents;
import dev.enhancequeue.telemetry.MemorySnapshot;
import dev.enhancequeue.telemetry.MemoryTelemetry;
import dev.enhancequeue.telemetry.OsMemoryStatsSource;
import dev.enhancequeue.telemetry.PressureLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * EnhancementEngine wires the shared components and hands out named batch queues.
 *
 * <p>All queues of one engine share the telemetry, the artifact cache and the history stack, and
 * call the same enhancer and storage. Each queue keeps its own items and worker thread, but
 * enhancer calls are serialized engine-wide: two queues never enhance at the same time.
 *
 * <p><strong>Usage Pattern:</strong>
 * <pre>{@code
 * try (EnhancementEngine engine = new EnhancementEngine(config, enhancer, new FileSystemImageStorage())) {
 *     BatchQueue queue = engine.queue();
 *     queue.submit(files, EnhancementMode.GENERAL);
 *     queue.start();
 * }
 * }</pre>
 *
 * <p>Memory pressure escalating to WARNING or CRITICAL flushes the cache's memory tier.
 */
public class EnhancementEngine implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EnhancementEngine.class);

    private final EngineConfig config;
    private final Enhancer enhancer;
    private final ImageStorage storage;
    private final MemoryTelemetry telemetry;
    private final ArtifactCache cache;
    private final HistoryStack history;
    private final Map<String, EnhancementBatchQueue> activeQueues = new ConcurrentHashMap<>();

    /**
     * Builds the default stack: OS memory statistics, JVM heap pressure events, and a RocksDB disk
     * tier when {@code config.diskCacheEnabled}.
     */
    public EnhancementEngine(EngineConfig config, Enhancer enhancer, ImageStorage storage) {
        this(config, enhancer, storage,
                new MemoryTelemetry(new OsMemoryStatsSource(),
                        new JvmMemoryPressureEvents(config.getWarningUsagePercent() / 100.0,
                                config.getCriticalUsagePercent() / 100.0),
                        config),
                new ArtifactCache(config, config.isDiskCacheEnabled() ? new RocksDiskTier(config) : null),
                new HistoryStack(config.getHistoryMaxSize(), null));
    }

    /**
     * Uses the given components. The engine takes ownership and closes them in {@link #close()}.
     */
    public EnhancementEngine(EngineConfig config,
                             Enhancer enhancer,
                             ImageStorage storage,
                             MemoryTelemetry telemetry,
                             ArtifactCache cache,
                             HistoryStack history) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.enhancer = new SerializedEnhancer(Objects.requireNonNull(enhancer, "enhancer cannot be null"));
        this.storage = Objects.requireNonNull(storage, "storage cannot be null");
        this.telemetry = Objects.requireNonNull(telemetry, "telemetry cannot be null");
        this.cache = Objects.requireNonNull(cache, "cache cannot be null");
        this.history = Objects.requireNonNull(history, "history cannot be null");

        telemetry.addListener(this::onPressureChanged);
        telemetry.start();
        logger.info("Enhancement engine started");
    }

    private void onPressureChanged(PressureLevel previous, MemorySnapshot current) {
        if (current.level().compareTo(previous) > 0 && current.level().isAtLeast(PressureLevel.WARNING)) {
            cache.onMemoryWarning();
        }
    }

    /**
     * @return the queue named by {@code config.queueName}
     */
    public BatchQueue queue() {
        return queue(config.getQueueName());
    }

    /**
     * Gets the named queue, creating it on first use. A closed queue is replaced by a fresh one.
     *
     * @throws IllegalArgumentException if name is empty or whitespace
     */
    public BatchQueue queue(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        if (name.trim().isEmpty()) {
            throw new IllegalArgumentException("name cannot be empty or whitespace");
        }
        return activeQueues.compute(name, (n, existing) -> {
            if (existing != null && !existing.isClosed()) {
                return existing;
            }
            return new EnhancementBatchQueue(n, config, enhancer, storage, telemetry, cache, history);
        });
    }

    public int getActiveQueueCount() {
        return activeQueues.size();
    }

    public MemoryTelemetry telemetry() {
        return telemetry;
    }

    public ArtifactCache cache() {
        return cache;
    }

    public HistoryStack history() {
        return history;
    }

    @Override
    public void close() {
        activeQueues.values().forEach(queue -> {
            try {
                queue.close();
            } catch (Exception e) {
                logger.warn("Failed to close queue '{}': {}", queue.name(), e.getMessage(), e);
            }
        });
        activeQueues.clear();
        cache.close();
        telemetry.close();
        logger.info("Enhancement engine stopped");
    }
}
