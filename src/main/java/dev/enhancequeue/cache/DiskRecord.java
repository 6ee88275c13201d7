package dev.enhancequeue.cache;

import java.util.Objects;

/**
 * A disk-tier hit: metadata plus the encoded image.
 */
public record DiskRecord(DiskEntryMeta meta, byte[] payload) {
    public DiskRecord {
        Objects.requireNonNull(meta, "meta cannot be null");
        Objects.requireNonNull(payload, "payload cannot be null");
    }
}
