package dev.enhancequeue.api;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One submitted reference that was not enqueued.
 *
 * @param source  the rejected reference
 * @param reason  machine-readable cause
 * @param message human-readable explanation, prefixed with the file name
 */
public record Rejection(Path source, RejectionReason reason, String message) {
    public Rejection {
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(reason, "reason cannot be null");
        Objects.requireNonNull(message, "message cannot be null");
    }
}
