package dev.enhancequeue.client;

import dev.enhancequeue.api.EnhancementException;
import dev.enhancequeue.api.EnhancementMode;
import dev.enhancequeue.api.Enhancer;

import java.util.Objects;

/**
 * Admits one {@link Enhancer#enhance} call at a time across every queue of an engine. Each queue
 * already runs its items sequentially; this extends that to the engine, since the underlying
 * enhancer is not safe to run concurrently with itself.
 */
final class SerializedEnhancer implements Enhancer {
    private final Enhancer delegate;
    private final Object enhanceLock = new Object();

    SerializedEnhancer(Enhancer delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate cannot be null");
    }

    @Override
    public byte[] enhance(byte[] input, EnhancementMode mode) throws EnhancementException {
        synchronized (enhanceLock) {
            return delegate.enhance(input, mode);
        }
    }
}
