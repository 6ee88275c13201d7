package dev.enhancequeue.storage;

import dev.enhancequeue.api.ImageDimensions;
import dev.enhancequeue.api.ImageStorage;
import dev.enhancequeue.ser.ImageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.stream.ImageInputStream;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Local file system storage. Writes go to a temporary sibling first and are moved into place,
 * so a failed write never leaves a truncated output behind.
 */
public class FileSystemImageStorage implements ImageStorage {
    private static final Logger logger = LoggerFactory.getLogger(FileSystemImageStorage.class);

    @Override
    public byte[] loadBytes(Path source) throws IOException {
        Objects.requireNonNull(source, "source cannot be null");
        return Files.readAllBytes(source);
    }

    @Override
    public void writeBytes(byte[] bytes, Path destination) throws IOException {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        Objects.requireNonNull(destination, "destination cannot be null");

        Path dir = destination.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path tmp = Files.createTempFile(dir, ".enhance-", ".tmp");
        try {
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, destination, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.debug("Saved {} ({} bytes)", destination.getFileName(), bytes.length);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    @Override
    public Optional<ImageDimensions> readDimensions(Path source) {
        if (!Files.isRegularFile(source)) {
            return Optional.empty();
        }
        try (ImageInputStream in = ImageIO.createImageInputStream(source.toFile())) {
            if (in == null) {
                return Optional.empty();
            }
            return ImageCodec.readDimensions(in);
        } catch (IOException | RuntimeException e) {
            logger.debug("Could not read dimensions of {}: {}", source, e.getMessage());
            return Optional.empty();
        }
    }
}
