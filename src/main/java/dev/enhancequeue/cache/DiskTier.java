package dev.enhancequeue.cache;

/**
 * Durable tier of the {@link ArtifactCache}, addressed by a hash of the cache key.
 *
 * Implementations are called from the cache's background writer and from readers on a
 * fast-tier miss, so they must tolerate concurrent get/put. Failures are reported as
 * exceptions; the cache decides how to degrade.
 */
public interface DiskTier extends AutoCloseable {

    void put(String key, DiskEntryMeta meta, byte[] payload) throws Exception;

    /**
     * @return the stored record, or null when absent
     */
    DiskRecord get(String key) throws Exception;

    void remove(String key) throws Exception;

    void clear() throws Exception;

    long entryCount();

    long sizeBytes();

    @Override
    default void close() throws Exception { /* no-op by default */ }
}
