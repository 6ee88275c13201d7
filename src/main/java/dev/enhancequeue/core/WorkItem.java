package dev.enhancequeue.core;

import dev.enhancequeue.api.EnhancementMode;
import dev.enhancequeue.api.ItemStatus;
import dev.enhancequeue.api.WorkItemSnapshot;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.Objects;
import java.util.UUID;

/**
 * Queue-owned mutable work item. Mutated only under the owning queue's lock; fields are
 * volatile so unlocked readers see whole values.
 */
final class WorkItem {
    private final UUID id;
    private final Path source;
    private final String key;
    private final EnhancementMode mode;

    private volatile ItemStatus status = ItemStatus.PENDING;
    private volatile double progress;
    private volatile String failureReason;
    private volatile BufferedImage result;
    private volatile Path output;

    WorkItem(Path source, String key, EnhancementMode mode) {
        this.id = UUID.randomUUID();
        this.source = Objects.requireNonNull(source, "source cannot be null");
        this.key = Objects.requireNonNull(key, "key cannot be null");
        this.mode = Objects.requireNonNull(mode, "mode cannot be null");
    }

    UUID id() { return id; }
    Path source() { return source; }
    String key() { return key; }
    EnhancementMode mode() { return mode; }
    ItemStatus status() { return status; }
    double progress() { return progress; }
    BufferedImage result() { return result; }

    String displayName() {
        Path name = source.getFileName();
        return name != null ? name.toString() : source.toString();
    }

    void markProcessing() {
        status = ItemStatus.PROCESSING;
        progress = 0.1;
    }

    void advance(double value) {
        if (value > progress) {
            progress = value;
        }
    }

    void markCompleted(BufferedImage image, Path written) {
        result = image;
        output = written;
        progress = 1.0;
        status = ItemStatus.COMPLETED;
    }

    void markFailed(String reason) {
        failureReason = reason;
        status = ItemStatus.FAILED;
    }

    void markCancelled() {
        status = ItemStatus.CANCELLED;
    }

    WorkItemSnapshot snapshot() {
        return new WorkItemSnapshot(id, source, mode, status, progress, failureReason, output, result != null);
    }
}
