package dev.enhancequeue.api;

/**
 * Receives a fresh {@link QueueSnapshot} after every observable change. Invoked on the thread
 * that made the change, after the queue's internal lock is released. Deliveries are serialized
 * per queue and arrive in snapshot order; implementations should return quickly.
 */
@FunctionalInterface
public interface BatchQueueListener {
    void onQueueChanged(QueueSnapshot snapshot);
}
