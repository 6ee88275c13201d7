package dev.enhancequeue.api;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Immutable view of a work item at one instant.
 *
 * @param id            unique identity, distinct even for equal sources
 * @param source        input reference
 * @param mode          operation fixed at submission
 * @param status        lifecycle state
 * @param progress      fraction in [0, 1]
 * @param failureReason set only when FAILED
 * @param output        written output location, set only when COMPLETED
 * @param hasResult     whether a result artifact is attached
 */
public record WorkItemSnapshot(UUID id, Path source, EnhancementMode mode, ItemStatus status, double progress,
                               String failureReason, Path output, boolean hasResult) {

    public String displayName() {
        Path name = source.getFileName();
        return name != null ? name.toString() : source.toString();
    }
}
