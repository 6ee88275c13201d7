package dev.enhancequeue.api;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

/**
 * Batch enhancement queue semantics:
 * - Items are processed strictly one at a time, visited in submission order (FIFO, no reordering).
 * - Admission is per reference: a full queue, an unsupported format, a duplicate source or an
 *   oversized image rejects that reference only; the rest of the batch is still accepted.
 * - Per-item failures mark that item FAILED and the batch continues. Only {@link #cancel()} and
 *   {@link #clearQueue()} stop a batch. There is no automatic retry.
 * - Pausing, resuming and cancelling are cooperative: they take effect at the worker's next safe
 *   point and never interrupt an enhancement call already in flight.
 * - Under critical memory pressure the queue pauses itself and resumes once pressure clears,
 *   unless the caller has also paused it.
 */
public interface BatchQueue extends AutoCloseable {

    /**
     * Validates and enqueues each reference as a PENDING item.
     */
    SubmissionResult submit(List<Path> sources, EnhancementMode mode);

    /**
     * Launches the worker. No-op when already running or when nothing is PENDING.
     */
    void start();

    void pause();

    void resume();

    /**
     * Stops processing at the next safe point and marks every PENDING or PROCESSING item CANCELLED.
     */
    void cancel();

    /**
     * Cancels, then removes every item.
     */
    void clearQueue();

    /**
     * Removes a PENDING or FAILED item.
     *
     * @return false if no item has this id
     * @throws IllegalStateException if the item is in any other state
     */
    boolean removeItem(UUID id);

    List<WorkItemSnapshot> items();

    QueueSnapshot snapshot();

    boolean isRunning();

    /**
     * @return true if paused by the caller or by memory pressure
     */
    boolean isPaused();

    void addListener(BatchQueueListener listener);

    void removeListener(BatchQueueListener listener);

    @Override
    void close();
}
