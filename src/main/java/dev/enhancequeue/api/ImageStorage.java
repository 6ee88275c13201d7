package dev.enhancequeue.api;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Source and destination I/O used by the queue.
 */
public interface ImageStorage {

    byte[] loadBytes(Path source) throws IOException;

    void writeBytes(byte[] bytes, Path destination) throws IOException;

    /**
     * Reads the pixel size of an image without decoding it.
     *
     * @return the dimensions, or empty when they cannot be discovered
     */
    Optional<ImageDimensions> readDimensions(Path source);
}
