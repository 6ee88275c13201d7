package dev.enhancequeue.core;

import dev.enhancequeue.api.BatchQueue;
import dev.enhancequeue.api.BatchQueueListener;
import dev.enhancequeue.api.EnhancementMode;
import dev.enhancequeue.api.Enhancer;
import dev.enhancequeue.api.ImageDimensions;
import dev.enhancequeue.api.ImageStorage;
import dev.enhancequeue.api.ItemStatus;
import dev.enhancequeue.api.QueueSnapshot;
import dev.enhancequeue.api.Rejection;
import dev.enhancequeue.api.RejectionReason;
import dev.enhancequeue.api.SubmissionResult;
import dev.enhancequeue.api.SupportedImageFormat;
import dev.enhancequeue.api.WorkItemSnapshot;
import dev.enhancequeue.cache.ArtifactCache;
import dev.enhancequeue.cache.CacheKeys;
import dev.enhancequeue.config.EngineConfig;
import dev.enhancequeue.history.HistoryStack;
import dev.enhancequeue.ser.ImageCodec;
import dev.enhancequeue.telemetry.MemorySnapshot;
import dev.enhancequeue.telemetry.MemoryTelemetry;
import dev.enhancequeue.telemetry.PressureLevel;
import dev.enhancequeue.telemetry.PressureListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A memory-aware, sequential batch queue for image enhancement.
 *
 * <p>This implementation provides:
 * <ul>
 *   <li>Itemized admission with a hard size cap, format, duplicate and dimension checks</li>
 *   <li>A single worker thread visiting PENDING items in submission order</li>
 *   <li>Cooperative pause/resume/cancel observed at well-defined safe points</li>
 *   <li>Automatic pause under CRITICAL memory pressure and automatic resume once it clears</li>
 *   <li>Result caching in an {@link ArtifactCache} and a {@link HistoryStack}</li>
 * </ul>
 *
 * <p>The worker runs passes: each pass snapshots the items PENDING at its start and visits them in
 * order; items submitted during a pass are picked up by the next one. Per-item progress moves
 * 0.1 (processing) -> 0.3 (loaded) -> 0.9 (enhanced) -> 1.0 (written).
 *
 * <p><strong>Pausing:</strong> a caller pause and a memory-pressure pause are tracked separately.
 * {@link #isPaused()} reports either; processing continues only when both are clear, so a caller
 * pause is never lifted by pressure relief and vice versa.
 *
 * <p><strong>Thread Safety:</strong> all item and flag mutations happen under one lock, from the
 * admission/control API or from the worker. Waiting uses a {@link Condition} with a timed poll as
 * fallback. No lock is held while loading, enhancing or writing. Each launch of the worker carries
 * a generation number; a worker whose generation is stale stops at its next safe point.
 *
 * <p><strong>Usage Example:</strong>
 * <pre>{@code
 * try (EnhancementBatchQueue queue = new EnhancementBatchQueue(config, enhancer, storage,
 *                                                              telemetry, cache, history)) {
 *     SubmissionResult result = queue.submit(List.of(Path.of("a.png"), Path.of("b.jpg")),
 *                                            EnhancementMode.GENERAL);
 *     queue.addListener(snapshot -> System.out.println(snapshot.progress()));
 *     queue.start();
 * }
 * }</pre>
 */
public class EnhancementBatchQueue implements BatchQueue {
    private static final Logger logger = LoggerFactory.getLogger(EnhancementBatchQueue.class);

    static final double PROGRESS_LOADED = 0.3;
    static final double PROGRESS_ENHANCED = 0.9;

    private static final long CLOSE_WAIT_SECONDS = 5;

    private final String name;
    private final EngineConfig config;
    private final Enhancer enhancer;
    private final ImageStorage storage;
    private final MemoryTelemetry telemetry;
    private final ArtifactCache cache;
    private final HistoryStack history;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition stateChanged = lock.newCondition();
    private final List<WorkItem> items = new ArrayList<>();
    private final List<BatchQueueListener> listeners = new CopyOnWriteArrayList<>();
    // taken after lock is released, never while holding it
    private final Object dispatchLock = new Object();
    private final ExecutorService worker;
    private final PressureListener pressureListener = this::onPressureChanged;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    // guarded by lock
    private boolean running;
    private boolean pausedByUser;
    private boolean throttled;
    private long generation;
    private WorkItem current;
    private Future<?> workerTask;

    /**
     * @param config    admission limits, poll intervals and output quality
     * @param enhancer  the transform applied to each item
     * @param storage   source/destination I/O
     * @param telemetry memory pressure signal used for self-throttling
     * @param cache     result cache; its memory tier is consulted before enhancing
     * @param history   receives every completed result
     */
    public EnhancementBatchQueue(EngineConfig config,
                                 Enhancer enhancer,
                                 ImageStorage storage,
                                 MemoryTelemetry telemetry,
                                 ArtifactCache cache,
                                 HistoryStack history) {
        this(config.getQueueName(), config, enhancer, storage, telemetry, cache, history);
    }

    /**
     * Creates a named queue; the name overrides {@code config.queueName}.
     */
    public EnhancementBatchQueue(String name,
                                 EngineConfig config,
                                 Enhancer enhancer,
                                 ImageStorage storage,
                                 MemoryTelemetry telemetry,
                                 ArtifactCache cache,
                                 HistoryStack history) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.enhancer = Objects.requireNonNull(enhancer, "enhancer cannot be null");
        this.storage = Objects.requireNonNull(storage, "storage cannot be null");
        this.telemetry = Objects.requireNonNull(telemetry, "telemetry cannot be null");
        this.cache = Objects.requireNonNull(cache, "cache cannot be null");
        this.history = Objects.requireNonNull(history, "history cannot be null");

        if (name.trim().isEmpty()) {
            throw new IllegalArgumentException("name cannot be empty or whitespace");
        }
        if (config.getMaxQueueSize() <= 0) {
            throw new IllegalArgumentException("maxQueueSize must be positive, got " + config.getMaxQueueSize());
        }

        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "batch-worker-" + name);
            t.setDaemon(true);
            return t;
        });
        telemetry.addListener(pressureListener);

        logger.info("Batch queue '{}' ready (max {} items, max dimension {})",
                name, config.getMaxQueueSize(), config.getMaxImageDimension());
    }

    // ---------------------------------------------------------------- admission

    @Override
    public SubmissionResult submit(List<Path> sources, EnhancementMode mode) {
        Objects.requireNonNull(sources, "sources cannot be null");
        Objects.requireNonNull(mode, "mode cannot be null");
        ensureOpen();

        // Read dimensions outside the lock; only supported formats are worth reading.
        List<Optional<ImageDimensions>> sizes = new ArrayList<>(sources.size());
        for (Path source : sources) {
            Objects.requireNonNull(source, "source cannot be null");
            sizes.add(SupportedImageFormat.of(source).isPresent() ? dimensionsOf(source) : Optional.empty());
        }

        List<UUID> accepted = new ArrayList<>();
        List<Rejection> rejections = new ArrayList<>();
        int total;
        lock.lock();
        try {
            for (int i = 0; i < sources.size(); i++) {
                Path source = sources.get(i);
                String key = CacheKeys.of(source);
                String fileName = displayName(source);

                if (items.size() >= config.getMaxQueueSize()) {
                    rejections.add(new Rejection(source, RejectionReason.QUEUE_FULL,
                            fileName + ": queue is full (max " + config.getMaxQueueSize() + " items)"));
                    continue;
                }
                if (SupportedImageFormat.of(source).isEmpty()) {
                    rejections.add(new Rejection(source, RejectionReason.UNSUPPORTED_FORMAT,
                            fileName + ": unsupported format (supported: "
                                    + SupportedImageFormat.supportedFormatsString() + ")"));
                    continue;
                }
                if (containsKey(key)) {
                    rejections.add(new Rejection(source, RejectionReason.DUPLICATE,
                            fileName + ": already in queue"));
                    continue;
                }
                Optional<ImageDimensions> dims = sizes.get(i);
                int max = config.getMaxImageDimension();
                if (dims.isPresent() && dims.get().exceeds(max)) {
                    rejections.add(new Rejection(source, RejectionReason.OVERSIZE,
                            fileName + ": image too large (" + dims.get() + ", limit " + max + "x" + max + ")"));
                    continue;
                }

                WorkItem item = new WorkItem(source, key, mode);
                items.add(item);
                accepted.add(item.id());
            }
            total = items.size();
        } finally {
            lock.unlock();
        }

        logger.info("Batch queue '{}': added {}, rejected {}, total {}",
                name, accepted.size(), rejections.size(), total);
        if (!accepted.isEmpty()) {
            fireChanged();
        }
        return new SubmissionResult(accepted.size(), accepted, rejections);
    }

    private Optional<ImageDimensions> dimensionsOf(Path source) {
        try {
            return storage.readDimensions(source);
        } catch (RuntimeException e) {
            // fail open: admission accepts what it cannot measure
            logger.debug("Dimension read failed for {}: {}", source, e.getMessage());
            return Optional.empty();
        }
    }

    private boolean containsKey(String key) {
        for (WorkItem item : items) {
            if (item.key().equals(key)) {
                return true;
            }
        }
        return false;
    }

    // ---------------------------------------------------------------- control

    @Override
    public void start() {
        ensureOpen();
        lock.lock();
        try {
            if (running) {
                return;
            }
            if (items.stream().noneMatch(i -> i.status() == ItemStatus.PENDING)) {
                logger.debug("Batch queue '{}': nothing pending, start ignored", name);
                return;
            }
            running = true;
            pausedByUser = false;
            throttled = false;
            launchWorker();
        } finally {
            lock.unlock();
        }
        logger.info("Batch queue '{}': starting", name);
        fireChanged();
    }

    @Override
    public void pause() {
        lock.lock();
        try {
            if (pausedByUser) {
                return;
            }
            pausedByUser = true;
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
        logger.info("Batch queue '{}': paused", name);
        fireChanged();
    }

    @Override
    public void resume() {
        lock.lock();
        try {
            if (!pausedByUser) {
                return;
            }
            pausedByUser = false;
            if (running && !closed.get() && (workerTask == null || workerTask.isDone())) {
                launchWorker();
            }
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
        logger.info("Batch queue '{}': resumed", name);
        fireChanged();
    }

    @Override
    public void cancel() {
        int cancelled = 0;
        lock.lock();
        try {
            running = false;
            pausedByUser = false;
            throttled = false;
            generation++;
            current = null;
            for (WorkItem item : items) {
                ItemStatus s = item.status();
                if (s == ItemStatus.PENDING || s == ItemStatus.PROCESSING) {
                    item.markCancelled();
                    cancelled++;
                }
            }
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
        logger.info("Batch queue '{}': cancelled ({} items)", name, cancelled);
        fireChanged();
    }

    @Override
    public void clearQueue() {
        cancel();
        lock.lock();
        try {
            items.clear();
        } finally {
            lock.unlock();
        }
        logger.info("Batch queue '{}': cleared", name);
        fireChanged();
    }

    @Override
    public boolean removeItem(UUID id) {
        Objects.requireNonNull(id, "id cannot be null");
        WorkItem removed = null;
        lock.lock();
        try {
            for (Iterator<WorkItem> it = items.iterator(); it.hasNext(); ) {
                WorkItem item = it.next();
                if (!item.id().equals(id)) {
                    continue;
                }
                if (!item.status().isRemovable()) {
                    throw new IllegalStateException("Cannot remove item " + id + " in state " + item.status());
                }
                it.remove();
                removed = item;
                break;
            }
        } finally {
            lock.unlock();
        }
        if (removed == null) {
            return false;
        }
        logger.info("Batch queue '{}': removed {}", name, removed.displayName());
        fireChanged();
        return true;
    }

    private void launchWorker() {
        long gen = ++generation;
        workerTask = worker.submit(() -> runWorker(gen));
    }

    // ---------------------------------------------------------------- worker

    private void runWorker(long gen) {
        MDC.put("queueName", name);
        try {
            logger.info("Batch queue '{}': worker started", name);
            boolean stopped = false;
            while (!stopped) {
                List<WorkItem> pass = pendingItems();
                if (pass.isEmpty()) {
                    break;
                }
                for (WorkItem item : pass) {
                    if (!awaitSafePoint(gen)) {
                        stopped = true;
                        break;
                    }
                    if (beginItem(item, gen)) {
                        try {
                            processItem(item);
                        } catch (Throwable t) {
                            // includes Errors such as OOM while decoding a large result
                            logger.error("Batch queue '{}': unexpected failure on {}: {}",
                                    name, item.displayName(), t.toString(), t);
                            fail(item, "Unexpected error: " + t);
                        }
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Batch queue '{}': worker interrupted", name);
        } catch (RuntimeException e) {
            logger.error("Batch queue '{}': worker failed: {}", name, e.getMessage(), e);
        } finally {
            finishWorker(gen);
            MDC.clear();
        }
    }

    private List<WorkItem> pendingItems() {
        lock.lock();
        try {
            List<WorkItem> pending = new ArrayList<>();
            for (WorkItem item : items) {
                if (item.status() == ItemStatus.PENDING) {
                    pending.add(item);
                }
            }
            return pending;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks while paused by the caller or throttled by memory pressure.
     *
     * @return false if this worker should stop (cancelled, superseded or closed)
     */
    private boolean awaitSafePoint(long gen) throws InterruptedException {
        while (true) {
            boolean proceed;
            boolean changed = false;
            lock.lock();
            try {
                if (!isCurrent(gen)) {
                    return false;
                }
                boolean critical = telemetry.shouldThrottle();
                if (critical != throttled) {
                    throttled = critical;
                    changed = true;
                    if (critical) {
                        logger.warn("Batch queue '{}': memory pressure critical, pausing", name);
                    } else {
                        logger.info("Batch queue '{}': memory pressure relieved, resuming", name);
                    }
                }
                proceed = !pausedByUser && !throttled;
                if (!proceed && !changed) {
                    long wait = throttled ? config.getThrottlePollIntervalMillis() : config.getPausePollIntervalMillis();
                    stateChanged.await(wait, TimeUnit.MILLISECONDS);
                }
            } finally {
                lock.unlock();
            }
            if (changed) {
                fireChanged();
            }
            if (proceed) {
                return true;
            }
        }
    }

    private boolean isCurrent(long gen) {
        return running && generation == gen && !closed.get();
    }

    private boolean beginItem(WorkItem item, long gen) {
        lock.lock();
        try {
            if (!isCurrent(gen) || item.status() != ItemStatus.PENDING || !items.contains(item)) {
                return false;
            }
            item.markProcessing();
            current = item;
        } finally {
            lock.unlock();
        }
        logger.debug("Processing: {}", item.displayName());
        fireChanged();
        return true;
    }

    private void processItem(WorkItem item) {
        byte[] input;
        try {
            input = storage.loadBytes(item.source());
        } catch (Exception e) {
            fail(item, "Failed to load image: " + describe(e));
            return;
        }
        if (!advance(item, PROGRESS_LOADED)) {
            return;
        }

        OutputNaming.OutputTarget target = OutputNaming.resolve(item.source(), item.mode());
        String outputKey = CacheKeys.of(target.destination());

        BufferedImage result = cache.get(outputKey).orElse(null);
        if (result != null) {
            logger.debug("Reusing cached result for {}", item.displayName());
        } else {
            byte[] enhanced;
            try {
                enhanced = enhancer.enhance(input, item.mode());
            } catch (Exception e) {
                fail(item, "Enhancement failed: " + describe(e));
                return;
            }
            try {
                result = ImageCodec.decode(enhanced);
            } catch (Exception e) {
                fail(item, "Enhancer returned an unreadable image: " + describe(e));
                return;
            }
        }
        if (!advance(item, PROGRESS_ENHANCED)) {
            return;
        }

        try {
            byte[] encoded = target.encoding() == OutputNaming.Encoding.PNG
                    ? ImageCodec.encodePng(result)
                    : ImageCodec.encodeJpeg(result, config.getLossyQuality());
            storage.writeBytes(encoded, target.destination());
        } catch (Exception e) {
            fail(item, "Failed to save image: " + describe(e));
            return;
        }

        if (complete(item, result, target.destination())) {
            try {
                cache.set(outputKey, result);
            } catch (RuntimeException e) {
                logger.debug("Result not cached for {}: {}", item.displayName(), e.getMessage());
            }
            history.push(result, item.mode());
        }
    }

    /**
     * @return false if the item left PROCESSING (cancelled or cleared) and should be abandoned
     */
    private boolean advance(WorkItem item, double progress) {
        lock.lock();
        try {
            if (item.status() != ItemStatus.PROCESSING) {
                return false;
            }
            item.advance(progress);
        } finally {
            lock.unlock();
        }
        fireChanged();
        return true;
    }

    private boolean complete(WorkItem item, BufferedImage result, Path written) {
        lock.lock();
        try {
            if (item.status() != ItemStatus.PROCESSING || !items.contains(item)) {
                return false;
            }
            item.markCompleted(result, written);
        } finally {
            lock.unlock();
        }
        logger.info("Completed: {} -> {}", item.displayName(), written.getFileName());
        fireChanged();
        return true;
    }

    private void fail(WorkItem item, String reason) {
        lock.lock();
        try {
            if (item.status() != ItemStatus.PROCESSING) {
                return;
            }
            item.markFailed(reason);
        } finally {
            lock.unlock();
        }
        logger.warn("Failed: {} - {}", item.displayName(), reason);
        fireChanged();
    }

    private void finishWorker(long gen) {
        QueueSnapshot summary = null;
        lock.lock();
        try {
            if (generation == gen) {
                running = false;
                throttled = false;
                current = null;
                summary = buildSnapshot();
            }
        } finally {
            lock.unlock();
        }
        if (summary != null) {
            logger.info("Batch queue '{}': complete. Total: {}, Completed: {}, Failed: {}",
                    name, summary.totalCount(), summary.completedCount(), summary.failedCount());
            fireChanged();
        }
    }

    // ---------------------------------------------------------------- pressure

    private void onPressureChanged(PressureLevel previous, MemorySnapshot snapshot) {
        boolean changed = false;
        lock.lock();
        try {
            boolean critical = snapshot.level() == PressureLevel.CRITICAL;
            if (running && critical != throttled) {
                throttled = critical;
                changed = true;
            }
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
        if (changed) {
            if (snapshot.level() == PressureLevel.CRITICAL) {
                logger.warn("Batch queue '{}': critical memory pressure detected, pausing", name);
            } else {
                logger.info("Batch queue '{}': memory pressure {}, resuming", name, snapshot.level());
            }
            fireChanged();
        }
    }

    // ---------------------------------------------------------------- observation

    @Override
    public List<WorkItemSnapshot> items() {
        return snapshot().items();
    }

    @Override
    public QueueSnapshot snapshot() {
        lock.lock();
        try {
            return buildSnapshot();
        } finally {
            lock.unlock();
        }
    }

    private QueueSnapshot buildSnapshot() {
        List<WorkItemSnapshot> views = new ArrayList<>(items.size());
        for (WorkItem item : items) {
            views.add(item.snapshot());
        }
        return QueueSnapshot.of(views, running, pausedByUser, throttled, current != null ? current.id() : null);
    }

    /**
     * @return the result artifact of a COMPLETED item
     */
    public Optional<BufferedImage> result(UUID id) {
        lock.lock();
        try {
            for (WorkItem item : items) {
                if (item.id().equals(id)) {
                    return Optional.ofNullable(item.result());
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isRunning() {
        lock.lock();
        try {
            return running;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isPaused() {
        lock.lock();
        try {
            return pausedByUser || throttled;
        } finally {
            lock.unlock();
        }
    }

    public boolean isThrottled() {
        lock.lock();
        try {
            return throttled;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void addListener(BatchQueueListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    @Override
    public void removeListener(BatchQueueListener listener) {
        listeners.remove(listener);
    }

    /**
     * Snapshot and delivery happen under one monitor, so listeners see snapshots in the order they
     * were taken and the last delivery always reflects the latest state.
     */
    private void fireChanged() {
        if (listeners.isEmpty()) {
            return;
        }
        synchronized (dispatchLock) {
            QueueSnapshot snapshot = snapshot();
            for (BatchQueueListener listener : listeners) {
                try {
                    listener.onQueueChanged(snapshot);
                } catch (RuntimeException e) {
                    logger.warn("Queue listener failed: {}", e.getMessage(), e);
                }
            }
        }
    }

    // ---------------------------------------------------------------- lifecycle

    public String name() {
        return name;
    }

    public boolean isClosed() {
        return closed.get();
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Queue is closed: " + name);
        }
    }

    /**
     * Cancels outstanding work, detaches from telemetry and stops the worker thread.
     * Idempotent. Shared collaborators (cache, telemetry, history) are not closed.
     */
    @Override
    public void close() {
        if (closed.get()) {
            logger.debug("Close called on already closed queue '{}'", name);
            return;
        }
        MDC.put("queueName", name);
        try {
            cancel();
            closed.set(true);
            telemetry.removeListener(pressureListener);
            worker.shutdown();
            try {
                if (!worker.awaitTermination(CLOSE_WAIT_SECONDS, TimeUnit.SECONDS)) {
                    logger.warn("Worker for queue '{}' still busy after {}s, interrupting", name, CLOSE_WAIT_SECONDS);
                    worker.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                worker.shutdownNow();
            }
            listeners.clear();
            logger.info("Batch queue '{}' closed", name);
        } finally {
            MDC.clear();
        }
    }

    private static String displayName(Path source) {
        Path fileName = source.getFileName();
        return fileName != null ? fileName.toString() : source.toString();
    }

    private static String describe(Exception e) {
        String msg = e.getMessage();
        return msg != null ? msg : e.getClass().getSimpleName();
    }
}
