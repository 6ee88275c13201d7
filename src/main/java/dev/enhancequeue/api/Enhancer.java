package dev.enhancequeue.api;

/**
 * The external enhancement transform. Called from queue worker threads, one call at a time across
 * an engine; may take seconds. Per-call timeouts are the implementation's concern.
 */
@FunctionalInterface
public interface Enhancer {

    /**
     * @param input encoded source image
     * @param mode  variant to apply
     * @return encoded output image, in any format ImageIO can read
     */
    byte[] enhance(byte[] input, EnhancementMode mode) throws EnhancementException;
}
