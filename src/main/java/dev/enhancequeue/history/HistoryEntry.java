package dev.enhancequeue.history;

import dev.enhancequeue.api.EnhancementMode;

import java.awt.image.BufferedImage;
import java.time.Instant;
import java.util.Objects;

/**
 * One produced artifact in the undo/redo history.
 *
 * @param image     the enhanced image
 * @param mode      the mode that produced it
 * @param createdAt when the entry was pushed
 */
public record HistoryEntry(BufferedImage image, EnhancementMode mode, Instant createdAt) {
    public HistoryEntry {
        Objects.requireNonNull(image, "image cannot be null");
        Objects.requireNonNull(mode, "mode cannot be null");
        Objects.requireNonNull(createdAt, "createdAt cannot be null");
    }
}
