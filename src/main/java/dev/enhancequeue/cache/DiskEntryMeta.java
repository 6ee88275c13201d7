package dev.enhancequeue.cache;

/**
 * Metadata stored beside each disk-tier payload. The source key guards against hash collisions.
 *
 * @param sourceKey      cache key the payload was stored under
 * @param width          image width in pixels
 * @param height         image height in pixels
 * @param encodedBytes   size of the stored payload
 * @param storedAtMillis wall-clock time of the write
 */
public record DiskEntryMeta(String sourceKey, int width, int height, long encodedBytes, long storedAtMillis) {
}
