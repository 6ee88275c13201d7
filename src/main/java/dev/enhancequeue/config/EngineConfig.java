package dev.enhancequeue.config;

import org.rocksdb.CompressionType;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

@Getter
@Setter
@Accessors(chain = true)
public class EngineConfig {
    // eq.* system properties override the defaults below; unparsable values fall back
    private static String prop(String key, String def) {
        String v = System.getProperty(key);
        return v == null ? def : v;
    }
    private static boolean boolProp(String key, boolean def) {
        String v = System.getProperty(key);
        return v == null ? def : Boolean.parseBoolean(v);
    }
    private static int intProp(String key, int def) {
        String v = System.getProperty(key);
        if (v == null) return def;
        try { return Integer.parseInt(v); } catch (NumberFormatException e) { return def; }
    }
    private static long longProp(String key, long def) {
        String v = System.getProperty(key);
        if (v == null) return def;
        try { return Long.parseLong(v); } catch (NumberFormatException e) { return def; }
    }

    private String queueName = prop("eq.queueName", "default");

    // Admission
    private int maxQueueSize = intProp("eq.maxQueueSize", 30);
    private int maxImageDimension = intProp("eq.maxImageDimension", 8192); // either side, pixels

    // Worker loop
    private long pausePollIntervalMillis = longProp("eq.pausePollIntervalMillis", 100);
    private long throttlePollIntervalMillis = longProp("eq.throttlePollIntervalMillis", 1000);

    // Telemetry
    private long telemetryRefreshIntervalMillis = longProp("eq.telemetryRefreshIntervalMillis", 2000);
    private double warningUsagePercent = 90.0;
    private double criticalUsagePercent = 95.0;
    private double recoveryUsagePercent = 80.0;   // WARNING demotes to NORMAL below this

    // Fast tier
    private int cacheMaxItems = intProp("eq.cacheMaxItems", 50);
    private long cacheMaxBytes = longProp("eq.cacheMaxBytes", 100L * 1024 * 1024);

    // Disk tier (RocksDB)
    private String cacheBasePath = prop("eq.cacheBasePath", "./data/enhance-cache");
    private boolean diskCacheEnabled = boolProp("eq.diskCacheEnabled", true);
    private boolean diskSyncWrites = false;
    private int diskWriteBufferSizeMB = 16;
    private CompressionType diskCompressionType = CompressionType.LZ4_COMPRESSION;

    // History
    private int historyMaxSize = intProp("eq.historyMaxSize", 10);

    // Output encoding
    private float lossyQuality = 0.85f;
}
