package dev.enhancequeue.api;

import java.util.List;
import java.util.UUID;

/**
 * Consistent view of a queue: items plus flags and counters derived from item statuses.
 *
 * <p>{@code completed + failed + cancelled + pending + processing == total} always holds, and
 * {@code progress == (completed + failed) / total} (0 for an empty queue).
 */
public record QueueSnapshot(List<WorkItemSnapshot> items,
                            boolean running,
                            boolean pausedByUser,
                            boolean throttled,
                            UUID currentItemId,
                            int pendingCount,
                            int processingCount,
                            int completedCount,
                            int failedCount,
                            int cancelledCount) {

    public QueueSnapshot {
        items = List.copyOf(items);
    }

    public static QueueSnapshot of(List<WorkItemSnapshot> items, boolean running, boolean pausedByUser,
                                   boolean throttled, UUID currentItemId) {
        int pending = 0, processing = 0, completed = 0, failed = 0, cancelled = 0;
        for (WorkItemSnapshot item : items) {
            switch (item.status()) {
                case PENDING: pending++; break;
                case PROCESSING: processing++; break;
                case COMPLETED: completed++; break;
                case FAILED: failed++; break;
                case CANCELLED: cancelled++; break;
                default: throw new IllegalStateException("Unknown status " + item.status());
            }
        }
        return new QueueSnapshot(items, running, pausedByUser, throttled, currentItemId,
                pending, processing, completed, failed, cancelled);
    }

    public int totalCount() {
        return items.size();
    }

    public boolean paused() {
        return pausedByUser || throttled;
    }

    public double progress() {
        int total = totalCount();
        return total == 0 ? 0.0 : (double) (completedCount + failedCount) / total;
    }
}
