package dev.enhancequeue.cache;

import dev.enhancequeue.config.EngineConfig;
import org.rocksdb.Options;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Disk tier backed by a single RocksDB instance.
 *
 * <p>Layout, with {@code h} the MD5 hex of the cache key:
 * <ul>
 *   <li>{@code meta:h} JSON {@link DiskEntryMeta}</li>
 *   <li>{@code img:h} encoded image bytes</li>
 * </ul>
 * Both keys of an entry are written and deleted in one {@link WriteBatch}.
 */
public class RocksDiskTier implements DiskTier {
    private static final Logger logger = LoggerFactory.getLogger(RocksDiskTier.class);

    static final String META_PREFIX = "meta:";
    static final String IMAGE_PREFIX = "img:";

    static { RocksDB.loadLibrary(); }

    private final String path;
    private final RocksDB db;
    private final WriteOptions writeOpts;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Opens (or creates) the disk tier under {@code config.cacheBasePath}.
     *
     * @throws RuntimeException if RocksDB cannot be opened
     */
    public RocksDiskTier(EngineConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        this.path = config.getCacheBasePath();

        try {
            File dir = new File(path);
            if (!dir.exists() && !dir.mkdirs()) {
                throw new RuntimeException("Failed to create directory: " + path);
            }
            try (Options options = new Options()
                    .setCreateIfMissing(true)
                    .setCompressionType(config.getDiskCompressionType())
                    .setWriteBufferSize((long) config.getDiskWriteBufferSizeMB() * 1024 * 1024)) {
                this.db = RocksDB.open(options, path);
            }
            logger.info("Opened disk cache at {}", path);
        } catch (Exception e) {
            logger.error("Failed to open disk cache at {}: {}", path, e.getMessage(), e);
            throw new RuntimeException("Failed to open disk cache at " + path, e);
        }

        try {
            this.writeOpts = new WriteOptions().setSync(config.isDiskSyncWrites());
        } catch (Exception e) {
            try {
                db.close();
            } catch (Exception closeError) {
                e.addSuppressed(closeError);
            }
            throw new RuntimeException("Failed to initialize write options for disk cache at " + path, e);
        }
    }

    @Override
    public void put(String key, DiskEntryMeta meta, byte[] payload) throws RocksDBException {
        ensureOpen();
        String hash = CacheKeys.hash(key);
        try (WriteBatch batch = new WriteBatch()) {
            batch.put(bytes(META_PREFIX + hash), DiskEntryMetaCodec.encode(meta));
            batch.put(bytes(IMAGE_PREFIX + hash), payload);
            db.write(writeOpts, batch);
        }
    }

    @Override
    public DiskRecord get(String key) throws RocksDBException {
        if (closed.get()) {
            return null;
        }
        String hash = CacheKeys.hash(key);
        byte[] metaBytes = db.get(bytes(META_PREFIX + hash));
        if (metaBytes == null) {
            return null;
        }
        DiskEntryMeta meta = DiskEntryMetaCodec.decode(metaBytes);
        if (!key.equals(meta.sourceKey())) {
            logger.debug("Disk cache hash collision for '{}' (stored '{}')", key, meta.sourceKey());
            return null;
        }
        byte[] payload = db.get(bytes(IMAGE_PREFIX + hash));
        return payload == null ? null : new DiskRecord(meta, payload);
    }

    @Override
    public void remove(String key) throws RocksDBException {
        ensureOpen();
        String hash = CacheKeys.hash(key);
        try (WriteBatch batch = new WriteBatch()) {
            batch.delete(bytes(META_PREFIX + hash));
            batch.delete(bytes(IMAGE_PREFIX + hash));
            db.write(writeOpts, batch);
        }
    }

    @Override
    public void clear() throws RocksDBException {
        ensureOpen();
        int deleted = 0;
        try (RocksIterator it = db.newIterator();
             WriteBatch batch = new WriteBatch()) {
            for (it.seekToFirst(); it.isValid(); it.next()) {
                batch.delete(Arrays.copyOf(it.key(), it.key().length));
                deleted++;
            }
            db.write(writeOpts, batch);
        }
        logger.info("Cleared {} keys from disk cache at {}", deleted, path);
    }

    @Override
    public long entryCount() {
        return scanMeta(false);
    }

    @Override
    public long sizeBytes() {
        return scanMeta(true);
    }

    private long scanMeta(boolean sumBytes) {
        if (closed.get()) {
            return 0;
        }
        byte[] prefix = bytes(META_PREFIX);
        long total = 0;
        try (ReadOptions ro = new ReadOptions().setFillCache(false);
             RocksIterator it = db.newIterator(ro)) {
            for (it.seek(prefix); it.isValid() && startsWith(it.key(), prefix); it.next()) {
                if (sumBytes) {
                    total += DiskEntryMetaCodec.decode(it.value()).encodedBytes();
                } else {
                    total++;
                }
            }
        } catch (RuntimeException e) {
            logger.warn("Failed to scan disk cache at {}: {}", path, e.getMessage(), e);
            return -1;
        }
        return total;
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Disk cache is closed: " + path);
        }
    }

    private static boolean startsWith(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) return false;
        for (int i = 0; i < prefix.length; i++) {
            if (key[i] != prefix[i]) return false;
        }
        return true;
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            writeOpts.close();
        } catch (Exception e) {
            logger.warn("Failed to close write options for disk cache at {}: {}", path, e.getMessage(), e);
        }
        try {
            db.close();
            logger.info("Closed disk cache at {}", path);
        } catch (Exception e) {
            logger.error("Failed to close disk cache at {}: {}", path, e.getMessage(), e);
        }
    }
}
