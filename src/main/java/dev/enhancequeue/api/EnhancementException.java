package dev.enhancequeue.api;

/**
 * Raised by an {@link Enhancer} when a transform cannot produce output.
 */
public class EnhancementException extends Exception {
    public EnhancementException(String message) {
        super(message);
    }

    public EnhancementException(String message, Throwable cause) {
        super(message, cause);
    }
}
