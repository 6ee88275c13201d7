package dev.enhancequeue.core;

import dev.enhancequeue.api.EnhancementMode;
import dev.enhancequeue.api.ItemStatus;
import dev.enhancequeue.api.QueueSnapshot;
import dev.enhancequeue.api.RejectionReason;
import dev.enhancequeue.api.SubmissionResult;
import dev.enhancequeue.api.WorkItemSnapshot;
import dev.enhancequeue.cache.ArtifactCache;
import dev.enhancequeue.cache.CacheKeys;
import dev.enhancequeue.cache.LruMemoryTier;
import dev.enhancequeue.config.EngineConfig;
import dev.enhancequeue.history.HistoryStack;
import dev.enhancequeue.telemetry.MemoryTelemetry;
import dev.enhancequeue.testing.ControllableEnhancer;
import dev.enhancequeue.testing.InMemoryImageStorage;
import dev.enhancequeue.testing.ScriptedMemorySource;
import dev.enhancequeue.testing.TestImages;
import dev.enhancequeue.testing.Waits;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class EnhancementBatchQueueTest {

    private static final long TIMEOUT = 5_000;

    private final InMemoryImageStorage storage = new InMemoryImageStorage();
    private final ControllableEnhancer enhancer = new ControllableEnhancer();
    private final ScriptedMemorySource memory = new ScriptedMemorySource();
    private MemoryTelemetry telemetry;
    private ArtifactCache cache;
    private HistoryStack history;
    private EnhancementBatchQueue queue;

    @BeforeEach
    void setUp() {
        newQueue(new EngineConfig().setMaxQueueSize(30));
    }

    private void newQueue(EngineConfig cfg) {
        cfg.setPausePollIntervalMillis(20).setThrottlePollIntervalMillis(50);
        telemetry = new MemoryTelemetry(memory, null, cfg);
        telemetry.refresh();
        cache = new ArtifactCache(new LruMemoryTier(50, 100L * 1024 * 1024), null, null);
        history = new HistoryStack();
        queue = new EnhancementBatchQueue("test", cfg, enhancer, storage, telemetry, cache, history);
    }

    @AfterEach
    void tearDown() {
        enhancer.release();
        if (queue != null) queue.close();
        if (cache != null) cache.close();
        if (telemetry != null) telemetry.close();
    }

    private List<Path> sources(int n) {
        List<Path> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(storage.add("img" + i + ".png", 4, 4));
        }
        return out;
    }

    private void awaitIdle() {
        Waits.until(() -> !queue.isRunning(), TIMEOUT, "queue idle");
    }

    private ItemStatus statusOf(UUID id) {
        return queue.items().stream().filter(i -> i.id().equals(id)).findFirst().orElseThrow().status();
    }

    // ---------------------------------------------------------------- admission

    @Test
    void submit_acceptsInOrderWithDistinctIds() {
        List<Path> files = sources(3);
        SubmissionResult r = queue.submit(files, EnhancementMode.GENERAL);

        assertEquals(3, r.accepted());
        assertEquals(0, r.rejected());
        assertEquals(3, Set.copyOf(r.acceptedIds()).size());
        List<WorkItemSnapshot> items = queue.items();
        for (int i = 0; i < 3; i++) {
            assertEquals(files.get(i), items.get(i).source());
            assertEquals(r.acceptedIds().get(i), items.get(i).id());
            assertEquals(ItemStatus.PENDING, items.get(i).status());
            assertEquals(0.0, items.get(i).progress());
        }
        assertFalse(queue.isRunning());
    }

    @Test
    void submit_rejectsUnsupportedAndDuplicatesPerReference() {
        Path a = storage.add("a.png", 4, 4);
        Path txt = Path.of("notes.txt");
        SubmissionResult r = queue.submit(List.of(a, txt, a), EnhancementMode.GENERAL);

        assertEquals(1, r.accepted());
        assertEquals(2, r.rejected());
        assertEquals(RejectionReason.UNSUPPORTED_FORMAT, r.rejections().get(0).reason());
        assertTrue(r.rejections().get(0).message().startsWith("notes.txt: unsupported format"));
        assertEquals(RejectionReason.DUPLICATE, r.rejections().get(1).reason());
        assertEquals("a.png: already in queue", r.rejections().get(1).message());

        SubmissionResult again = queue.submit(List.of(a), EnhancementMode.ANIME);
        assertEquals(RejectionReason.DUPLICATE, again.rejections().get(0).reason());
    }

    @Test
    void submit_capAppliesAcrossBatchesAndIsCheckedFirst() {
        newQueueWithCap(3);
        SubmissionResult first = queue.submit(sources(5), EnhancementMode.GENERAL);
        assertEquals(3, first.accepted());
        assertEquals(2, first.rejected());
        assertEquals(RejectionReason.QUEUE_FULL, first.rejections().get(0).reason());
        assertEquals("img3.png: queue is full (max 3 items)", first.rejections().get(0).message());

        SubmissionResult second = queue.submit(List.of(Path.of("other.txt")), EnhancementMode.GENERAL);
        assertEquals(RejectionReason.QUEUE_FULL, second.rejections().get(0).reason());
        assertEquals(3, queue.snapshot().totalCount());
    }

    @Test
    void submit_cancelledItemsStillCountTowardCap() {
        newQueueWithCap(2);
        queue.submit(sources(2), EnhancementMode.GENERAL);
        queue.cancel();
        SubmissionResult r = queue.submit(List.of(storage.add("late.png", 4, 4)), EnhancementMode.GENERAL);
        assertEquals(0, r.accepted());

        queue.clearQueue();
        assertEquals(1, queue.submit(List.of(storage.add("late.png", 4, 4)), EnhancementMode.GENERAL).accepted());
    }

    @Test
    void oversizedImage_isRejectedAndTheRestCompletes() {
        List<Path> files = sources(3);
        files.add(1, storage.addWithReportedSize("huge.png", 9000, 100));

        SubmissionResult r = queue.submit(files, EnhancementMode.GENERAL);
        assertEquals(3, r.accepted());
        assertEquals(RejectionReason.OVERSIZE, r.rejections().get(0).reason());
        assertEquals("huge.png: image too large (9000x100, limit 8192x8192)", r.rejections().get(0).message());

        queue.start();
        awaitIdle();

        QueueSnapshot snap = queue.snapshot();
        assertEquals(3, snap.totalCount());
        assertEquals(3, snap.completedCount());
        assertEquals(1.0, snap.progress());
    }

    @Test
    void unknownDimensions_imageIsAdmitted() {
        Path unknown = Path.of("unknown-size.jpg");
        SubmissionResult r = queue.submit(List.of(unknown), EnhancementMode.GENERAL);
        assertEquals(1, r.accepted());
    }

    // ---------------------------------------------------------------- processing

    @Test
    void start_processesAllAndWritesOutputs() {
        List<Path> files = sources(3);
        queue.submit(files, EnhancementMode.DETAIL);
        queue.start();
        awaitIdle();

        for (WorkItemSnapshot item : queue.items()) {
            assertEquals(ItemStatus.COMPLETED, item.status());
            assertEquals(1.0, item.progress());
            assertTrue(item.hasResult());
            assertTrue(item.output().getFileName().toString().endsWith("_detail_4x.png"));
            assertTrue(storage.exists(item.output()));
            assertTrue(queue.result(item.id()).isPresent());
        }
        assertEquals(3, enhancer.calls());
        assertEquals(3, history.size());
        assertEquals(EnhancementMode.DETAIL, history.current().orElseThrow().mode());
        assertNull(queue.snapshot().currentItemId());
    }

    @Test
    void progressMovesThroughStages() {
        Path file = sources(1).get(0);
        List<Double> seen = new CopyOnWriteArrayList<>();
        queue.addListener(s -> s.items().forEach(i -> seen.add(i.progress())));
        queue.submit(List.of(file), EnhancementMode.GENERAL);
        queue.start();
        awaitIdle();
        Waits.until(() -> seen.contains(1.0), TIMEOUT, "final progress observed");

        assertEquals(List.of(0.0, 0.1, EnhancementBatchQueue.PROGRESS_LOADED, EnhancementBatchQueue.PROGRESS_ENHANCED, 1.0),
                new ArrayList<>(new LinkedHashSet<>(seen)));
    }

    @Test
    void failingItem_doesNotStopTheBatch() {
        enhancer.failOnCall(2);
        Path missing = Path.of("gone.png");
        List<Path> files = sources(3);
        files.add(missing);
        queue.submit(files, EnhancementMode.GENERAL);
        queue.start();
        awaitIdle();

        List<WorkItemSnapshot> items = queue.items();
        assertEquals(ItemStatus.COMPLETED, items.get(0).status());
        assertEquals(ItemStatus.FAILED, items.get(1).status());
        assertTrue(items.get(1).failureReason().startsWith("Enhancement failed: model rejected input"));
        assertEquals(ItemStatus.COMPLETED, items.get(2).status());
        assertEquals(ItemStatus.FAILED, items.get(3).status());
        assertTrue(items.get(3).failureReason().startsWith("Failed to load image"));

        QueueSnapshot snap = queue.snapshot();
        assertEquals(2, snap.completedCount());
        assertEquals(2, snap.failedCount());
        assertEquals(1.0, snap.progress());
    }

    @Test
    void errorFromEnhancer_failsItemAndBatchContinues() {
        enhancer.errorOnCall(1);
        List<UUID> ids = queue.submit(sources(3), EnhancementMode.GENERAL).acceptedIds();
        queue.start();
        awaitIdle();

        WorkItemSnapshot first = queue.items().get(0);
        assertEquals(ItemStatus.FAILED, first.status());
        assertTrue(first.failureReason().contains("OutOfMemoryError"));
        assertEquals(ItemStatus.COMPLETED, statusOf(ids.get(1)));
        assertEquals(ItemStatus.COMPLETED, statusOf(ids.get(2)));

        QueueSnapshot snap = queue.snapshot();
        assertEquals(1, snap.failedCount());
        assertEquals(2, snap.completedCount());
        assertEquals(1.0, snap.progress());
        assertTrue(queue.removeItem(ids.get(0)));
    }

    @Test
    void writeFailure_marksItemFailed() {
        Path file = sources(1).get(0);
        storage.failWritesTo(OutputNaming.resolve(file, EnhancementMode.GENERAL).destination());
        queue.submit(List.of(file), EnhancementMode.GENERAL);
        queue.start();
        awaitIdle();

        WorkItemSnapshot item = queue.items().get(0);
        assertEquals(ItemStatus.FAILED, item.status());
        assertTrue(item.failureReason().startsWith("Failed to save image"));
        assertEquals(0, history.size());
    }

    @Test
    void cachedResult_skipsEnhancer() {
        Path file = sources(1).get(0);
        Path output = OutputNaming.resolve(file, EnhancementMode.GENERAL).destination();
        cache.set(CacheKeys.of(output), TestImages.image(16, 16));

        queue.submit(List.of(file), EnhancementMode.GENERAL);
        queue.start();
        awaitIdle();

        assertEquals(0, enhancer.calls());
        assertEquals(ItemStatus.COMPLETED, queue.items().get(0).status());
        assertEquals(16, queue.result(queue.items().get(0).id()).orElseThrow().getWidth());
    }

    @Test
    void completedResult_isCachedUnderOutputKey() {
        Path file = sources(1).get(0);
        queue.submit(List.of(file), EnhancementMode.ANIME);
        queue.start();
        awaitIdle();

        Path output = queue.items().get(0).output();
        assertTrue(cache.get(CacheKeys.of(output)).isPresent());
    }

    @Test
    void submissionsDuringRun_arePickedUpInTheSameRun() throws Exception {
        enhancer.hold();
        queue.submit(sources(1), EnhancementMode.GENERAL);
        queue.start();
        assertTrue(enhancer.awaitCall(TIMEOUT));

        queue.submit(List.of(storage.add("late.png", 4, 4)), EnhancementMode.GENERAL);
        enhancer.release();
        awaitIdle();

        assertEquals(2, queue.snapshot().completedCount());
    }

    @Test
    void start_withNothingPending_isNoOp() {
        queue.start();
        assertFalse(queue.isRunning());
    }

    // ---------------------------------------------------------------- control

    @Test
    void pause_holdsNextItemUntilResume() throws Exception {
        enhancer.hold();
        List<UUID> ids = queue.submit(sources(3), EnhancementMode.GENERAL).acceptedIds();
        queue.start();
        assertTrue(enhancer.awaitCall(TIMEOUT));

        queue.pause();
        assertTrue(queue.isPaused());
        enhancer.release();
        Waits.until(() -> statusOf(ids.get(0)) == ItemStatus.COMPLETED, TIMEOUT, "in-flight item completes");

        Thread.sleep(150);
        assertEquals(1, enhancer.calls());
        assertEquals(ItemStatus.PENDING, statusOf(ids.get(1)));
        assertTrue(queue.isRunning());

        queue.resume();
        assertFalse(queue.isPaused());
        awaitIdle();
        assertEquals(3, queue.snapshot().completedCount());
    }

    @Test
    void cancel_marksOutstandingItemsAndDiscardsInFlightResult() throws Exception {
        enhancer.hold();
        List<UUID> ids = queue.submit(sources(3), EnhancementMode.GENERAL).acceptedIds();
        queue.start();
        assertTrue(enhancer.awaitCall(TIMEOUT));

        queue.cancel();
        assertFalse(queue.isRunning());
        assertEquals(3, queue.snapshot().cancelledCount());

        enhancer.release();
        Waits.until(() -> enhancer.finished() == 1, TIMEOUT, "in-flight call returns");
        Thread.sleep(150);

        assertEquals(ItemStatus.CANCELLED, statusOf(ids.get(0)));
        assertEquals(1, enhancer.calls());
        assertEquals(0, history.size());

        queue.start();
        assertFalse(queue.isRunning(), "nothing pending after cancel");
    }

    @Test
    void clearQueue_removesEverything() throws Exception {
        enhancer.hold();
        queue.submit(sources(3), EnhancementMode.GENERAL);
        queue.start();
        assertTrue(enhancer.awaitCall(TIMEOUT));

        queue.clearQueue();
        enhancer.release();

        QueueSnapshot snap = queue.snapshot();
        assertEquals(0, snap.totalCount());
        assertFalse(snap.running());
        assertEquals(0.0, snap.progress());
    }

    @Test
    void removeItem_allowedOnlyForPendingOrFailed() throws Exception {
        enhancer.failOnCall(1);
        List<UUID> ids = queue.submit(sources(2), EnhancementMode.GENERAL).acceptedIds();
        assertTrue(queue.removeItem(ids.get(1)));
        assertEquals(1, queue.items().size());
        assertFalse(queue.removeItem(UUID.randomUUID()));

        queue.start();
        awaitIdle();
        assertEquals(ItemStatus.FAILED, statusOf(ids.get(0)));
        assertTrue(queue.removeItem(ids.get(0)));

        List<UUID> done = queue.submit(sources(1), EnhancementMode.GENERAL).acceptedIds();
        queue.start();
        awaitIdle();
        assertThrows(IllegalStateException.class, () -> queue.removeItem(done.get(0)));
    }

    @Test
    void removeItem_rejectsProcessingItem() throws Exception {
        enhancer.hold();
        List<UUID> ids = queue.submit(sources(1), EnhancementMode.GENERAL).acceptedIds();
        queue.start();
        assertTrue(enhancer.awaitCall(TIMEOUT));
        assertThrows(IllegalStateException.class, () -> queue.removeItem(ids.get(0)));
    }

    // ---------------------------------------------------------------- memory pressure

    @Test
    void criticalPressure_pausesAndReliefResumes() throws Exception {
        enhancer.hold();
        List<UUID> ids = queue.submit(sources(3), EnhancementMode.GENERAL).acceptedIds();
        queue.start();
        assertTrue(enhancer.awaitCall(TIMEOUT));

        memory.usage(97);
        telemetry.refresh();
        assertTrue(queue.isThrottled());
        assertTrue(queue.isPaused());

        enhancer.release();
        Waits.until(() -> statusOf(ids.get(0)) == ItemStatus.COMPLETED, TIMEOUT, "in-flight item completes");
        Thread.sleep(150);
        assertEquals(ItemStatus.PENDING, statusOf(ids.get(1)));

        memory.usage(50);
        telemetry.refresh();
        awaitIdle();
        assertEquals(3, queue.snapshot().completedCount());
        assertFalse(queue.isThrottled());
    }

    @Test
    void reliefDoesNotLiftCallerPause() throws Exception {
        enhancer.hold();
        List<UUID> ids = queue.submit(sources(2), EnhancementMode.GENERAL).acceptedIds();
        queue.start();
        assertTrue(enhancer.awaitCall(TIMEOUT));

        memory.usage(97);
        telemetry.refresh();
        queue.pause();
        enhancer.release();
        Waits.until(() -> statusOf(ids.get(0)) == ItemStatus.COMPLETED, TIMEOUT, "in-flight item completes");

        memory.usage(50);
        telemetry.refresh();
        Thread.sleep(150);
        assertTrue(queue.isPaused());
        assertEquals(ItemStatus.PENDING, statusOf(ids.get(1)));

        queue.resume();
        awaitIdle();
        assertEquals(2, queue.snapshot().completedCount());
    }

    @Test
    void criticalBeforeStart_holdsFirstItem() throws Exception {
        memory.usage(97);
        telemetry.refresh();
        queue.submit(sources(1), EnhancementMode.GENERAL);
        queue.start();

        Waits.until(() -> queue.isThrottled(), TIMEOUT, "worker notices pressure");
        assertEquals(0, enhancer.calls());

        memory.usage(40);
        telemetry.refresh();
        awaitIdle();
        assertEquals(1, queue.snapshot().completedCount());
    }

    // ---------------------------------------------------------------- observation and lifecycle

    @Test
    void listeners_receiveFinalSummary() {
        List<QueueSnapshot> seen = new CopyOnWriteArrayList<>();
        queue.addListener(seen::add);
        queue.submit(sources(2), EnhancementMode.GENERAL);
        queue.start();
        Waits.until(() -> !seen.isEmpty() && !seen.get(seen.size() - 1).running()
                && seen.get(seen.size() - 1).completedCount() == 2, TIMEOUT, "final summary");

        QueueSnapshot last = seen.get(seen.size() - 1);
        assertEquals(2, last.totalCount());
        assertEquals(0, last.pendingCount() + last.processingCount());
    }

    @Test
    void listeners_seeSnapshotsInOrderAcrossThreads() throws Exception {
        List<QueueSnapshot> seen = new CopyOnWriteArrayList<>();
        queue.addListener(snapshot -> {
            seen.add(snapshot);
            try {
                Thread.sleep(2);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        enhancer.hold();
        queue.submit(sources(4), EnhancementMode.GENERAL);
        queue.start();
        assertTrue(enhancer.awaitCall(TIMEOUT));
        enhancer.release();
        // submissions fire from this thread while the worker fires its own changes
        for (int i = 0; i < 8; i++) {
            queue.submit(List.of(storage.add("late" + i + ".png", 4, 4)), EnhancementMode.GENERAL);
        }
        Waits.until(() -> {
            QueueSnapshot last = seen.isEmpty() ? null : seen.get(seen.size() - 1);
            return last != null && !last.running() && last.totalCount() == 12 && !queue.isRunning();
        }, TIMEOUT, "final state delivered last");

        for (int i = 1; i < seen.size(); i++) {
            QueueSnapshot prev = seen.get(i - 1);
            QueueSnapshot next = seen.get(i);
            assertTrue(next.totalCount() >= prev.totalCount(), "total went back at delivery " + i);
            assertTrue(next.completedCount() >= prev.completedCount(), "completed went back at delivery " + i);
        }
        QueueSnapshot last = seen.get(seen.size() - 1);
        QueueSnapshot now = queue.snapshot();
        assertEquals(now.completedCount(), last.completedCount());
        assertEquals(now.pendingCount(), last.pendingCount());
        assertTrue(last.completedCount() >= 4);
    }

    @Test
    void failingListener_doesNotBreakProcessing() {
        queue.addListener(s -> { throw new IllegalStateException("listener bug"); });
        queue.submit(sources(2), EnhancementMode.GENERAL);
        queue.start();
        awaitIdle();
        assertEquals(2, queue.snapshot().completedCount());
    }

    @Test
    void closedQueue_rejectsSubmissions() {
        queue.submit(sources(1), EnhancementMode.GENERAL);
        queue.close();
        assertTrue(queue.isClosed());
        assertEquals(ItemStatus.CANCELLED, queue.items().get(0).status());
        assertThrows(IllegalStateException.class, () -> queue.submit(sources(1), EnhancementMode.GENERAL));
        assertThrows(IllegalStateException.class, () -> queue.start());
    }

    @Test
    void invalidConstruction_isRejected() {
        EngineConfig cfg = new EngineConfig().setMaxQueueSize(0);
        assertThrows(IllegalArgumentException.class,
                () -> new EnhancementBatchQueue("q", cfg, enhancer, storage, telemetry, cache, history));
        assertThrows(IllegalArgumentException.class,
                () -> new EnhancementBatchQueue(" ", new EngineConfig(), enhancer, storage, telemetry, cache, history));
    }

    private void newQueueWithCap(int cap) {
        queue.close();
        cache.close();
        telemetry.close();
        newQueue(new EngineConfig().setMaxQueueSize(cap));
    }
}
