package dev.enhancequeue.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * JSON form of {@link DiskEntryMeta} as stored under {@code meta:} keys. Unknown properties are
 * ignored so entries written with extra fields still read back.
 */
final class DiskEntryMetaCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private DiskEntryMetaCodec() {}

    static byte[] encode(DiskEntryMeta meta) {
        try {
            return MAPPER.writeValueAsBytes(meta);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode disk entry metadata for " + meta.sourceKey(), e);
        }
    }

    /**
     * @throws IllegalStateException if the bytes are not a readable metadata record
     */
    static DiskEntryMeta decode(byte[] bytes) {
        try {
            DiskEntryMeta meta = MAPPER.readValue(bytes, DiskEntryMeta.class);
            if (meta.sourceKey() == null) {
                throw new IllegalStateException("Disk entry metadata has no source key");
            }
            return meta;
        } catch (IOException e) {
            throw new IllegalStateException("Corrupt disk entry metadata (" + bytes.length + " bytes)", e);
        }
    }
}
