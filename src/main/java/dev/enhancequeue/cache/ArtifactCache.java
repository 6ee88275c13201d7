package dev.enhancequeue.cache;

import dev.enhancequeue.config.EngineConfig;
import dev.enhancequeue.ser.ImageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Two-tier cache of decoded images keyed by canonical source reference.
 *
 * <p>This implementation provides:
 * <ul>
 *   <li>a bounded in-memory {@link LruMemoryTier} answering reads synchronously</li>
 *   <li>an optional durable {@link DiskTier}, written in the background and consulted on a memory miss</li>
 *   <li>promotion of disk hits back into memory</li>
 *   <li>a memory flush hook for low-memory signals that keeps the disk tier intact</li>
 * </ul>
 *
 * <p>The cache is an optimization layer only: disk failures and undecodable payloads are logged
 * and behave like misses, never like errors.
 *
 * <p><strong>Thread Safety:</strong> safe for concurrent get/set from any thread. Disk writes and
 * removals run on one background thread in submission order, with no ordering guarantee relative
 * to reads: a read right after {@link #set} is answered by the memory tier.
 */
public class ArtifactCache implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ArtifactCache.class);

    private static final long CLOSE_DRAIN_SECONDS = 10;

    private final LruMemoryTier memory;
    private final DiskTier disk;
    private final Clock clock;
    private final ExecutorService diskWriter;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /**
     * @param config memory tier ceilings
     * @param disk   durable tier, null to run memory-only
     */
    public ArtifactCache(EngineConfig config, DiskTier disk) {
        this(new LruMemoryTier(config.getCacheMaxItems(), config.getCacheMaxBytes()), disk, null);
    }

    public ArtifactCache(LruMemoryTier memory, DiskTier disk, Clock clock) {
        this.memory = Objects.requireNonNull(memory, "memory cannot be null");
        this.disk = disk;
        this.clock = (clock != null) ? clock : Clock.systemUTC();
        this.diskWriter = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "artifact-cache-disk");
            t.setDaemon(true);
            return t;
        });
        logger.info("Artifact cache ready (memory: {} items / {} bytes, disk tier: {})",
                memory.maxItems(), memory.maxBytes(), disk != null ? "enabled" : "disabled");
    }

    /**
     * Stores the image in memory and schedules a best-effort disk write. Never fails on disk errors.
     *
     * @throws IllegalStateException if the cache is closed
     */
    public void set(String key, BufferedImage image) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(image, "image cannot be null");
        if (closed.get()) {
            throw new IllegalStateException("Artifact cache is closed");
        }

        memory.put(key, image);
        if (logger.isDebugEnabled()) {
            logger.debug("Cached '{}' ({} KB)", key, ImageCodec.estimateCost(image) / 1024);
        }

        if (disk != null) {
            submitDisk("write", key, () -> {
                byte[] png = ImageCodec.encodePng(image);
                DiskEntryMeta meta = new DiskEntryMeta(key, image.getWidth(), image.getHeight(),
                        png.length, clock.millis());
                disk.put(key, meta, png);
            });
        }
    }

    /**
     * Looks up the memory tier, then the disk tier. A disk hit is decoded and promoted into memory.
     *
     * @return the cached image, or empty on a miss
     */
    public Optional<BufferedImage> get(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        if (closed.get()) {
            return Optional.empty();
        }

        BufferedImage image = memory.get(key);
        if (image != null) {
            hits.incrementAndGet();
            logger.debug("Cache HIT (memory): {}", key);
            return Optional.of(image);
        }

        if (disk != null) {
            try {
                DiskRecord record = disk.get(key);
                if (record != null) {
                    BufferedImage decoded = ImageCodec.decode(record.payload());
                    memory.put(key, decoded);
                    hits.incrementAndGet();
                    logger.debug("Cache HIT (disk): {}", key);
                    return Optional.of(decoded);
                }
            } catch (Exception e) {
                logger.warn("Disk cache read failed for '{}', treating as miss: {}", key, e.getMessage());
            }
        }

        misses.incrementAndGet();
        logger.debug("Cache MISS: {}", key);
        return Optional.empty();
    }

    public void remove(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        if (closed.get()) {
            return;
        }
        memory.remove(key);
        if (disk != null) {
            submitDisk("remove", key, () -> disk.remove(key));
        }
    }

    public void clearAll() {
        if (closed.get()) {
            return;
        }
        memory.clear();
        if (disk != null) {
            submitDisk("clear", "*", disk::clear);
        }
        logger.info("All cache tiers cleared");
    }

    /**
     * Low-memory response: drops every memory-resident entry and keeps the disk tier.
     */
    public void onMemoryWarning() {
        int dropped = memory.size();
        memory.clear();
        logger.warn("Memory warning - flushed {} entries from memory tier", dropped);
    }

    /**
     * Blocks until every disk operation submitted so far has run, or the timeout elapses.
     *
     * @return true if the queue of disk operations drained in time
     */
    public boolean flushPendingWrites(long timeout, TimeUnit unit) {
        if (closed.get()) {
            return true;
        }
        try {
            diskWriter.submit(() -> { }).get(timeout, unit);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException | TimeoutException | RejectedExecutionException e) {
            return false;
        }
    }

    public CacheStats stats() {
        long diskEntries = disk != null ? disk.entryCount() : -1;
        long diskBytes = disk != null ? disk.sizeBytes() : -1;
        return new CacheStats(memory.size(), memory.totalCost(), diskEntries, diskBytes, hits.get(), misses.get());
    }

    public LruMemoryTier memoryTier() {
        return memory;
    }

    private void submitDisk(String op, String key, DiskTask task) {
        try {
            diskWriter.execute(() -> {
                try {
                    task.run();
                } catch (Exception e) {
                    logger.warn("Disk cache {} failed for '{}': {}", op, key, e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            logger.debug("Disk cache {} skipped for '{}': writer stopped", op, key);
        }
    }

    @FunctionalInterface
    private interface DiskTask {
        void run() throws Exception;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Drains pending disk operations, then closes the disk tier. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        diskWriter.shutdown();
        try {
            if (!diskWriter.awaitTermination(CLOSE_DRAIN_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Disk cache writer did not drain within {}s", CLOSE_DRAIN_SECONDS);
                diskWriter.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            diskWriter.shutdownNow();
        }
        memory.clear();
        if (disk != null) {
            try {
                disk.close();
            } catch (Exception e) {
                logger.warn("Failed to close disk tier: {}", e.getMessage(), e);
            }
        }
        logger.info("Artifact cache closed");
    }
}
