package dev.enhancequeue.cache;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Derives cache keys from source references and stable disk names from cache keys.
 */
public final class CacheKeys {
    private CacheKeys() {}

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    /**
     * @return the canonical form of a source reference: absolute and normalized
     */
    public static String of(Path source) {
        return source.toAbsolutePath().normalize().toString();
    }

    /**
     * @return lowercase hex MD5 of the key's UTF-8 bytes
     */
    public static String hash(String key) {
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(key.getBytes(StandardCharsets.UTF_8));
            char[] out = new char[digest.length * 2];
            for (int i = 0; i < digest.length; i++) {
                out[i * 2] = HEX[(digest[i] >> 4) & 0x0F];
                out[i * 2 + 1] = HEX[digest[i] & 0x0F];
            }
            return new String(out);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
