package dev.enhancequeue.core;

import dev.enhancequeue.api.EnhancementMode;
import dev.enhancequeue.api.SupportedImageFormat;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Derives where and how an enhanced image is written.
 *
 * <p>Output goes next to the source as {@code {basename}{modeSuffix}_4x.{ext}}:
 * <ul>
 *   <li>jpg/jpeg: JPEG, source extension kept</li>
 *   <li>webp: JPEG, written as .jpg</li>
 *   <li>png, heic/heif, bmp, tiff/tif: PNG, written as .png</li>
 *   <li>anything else: JPEG, written as .jpg</li>
 * </ul>
 */
public final class OutputNaming {
    private OutputNaming() {}

    static final String SCALE_TAG = "_4x";

    public enum Encoding {
        PNG,
        JPEG
    }

    /**
     * @param destination file to write
     * @param encoding    codec to encode with
     */
    public record OutputTarget(Path destination, Encoding encoding) {}

    public static OutputTarget resolve(Path source, EnhancementMode mode) {
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(mode, "mode cannot be null");

        String ext = SupportedImageFormat.extensionOf(source);
        Optional<SupportedImageFormat> format = SupportedImageFormat.fromExtension(ext);

        Encoding encoding;
        String outExt;
        if (format.isPresent() && format.get().isLossless()) {
            encoding = Encoding.PNG;
            outExt = "png";
        } else if (format.isPresent() && format.get() == SupportedImageFormat.JPEG) {
            encoding = Encoding.JPEG;
            outExt = ext;
        } else {
            encoding = Encoding.JPEG;
            outExt = "jpg";
        }

        String name = basename(source);
        return new OutputTarget(source.resolveSibling(name + mode.filenameSuffix() + SCALE_TAG + "." + outExt), encoding);
    }

    static String basename(Path source) {
        Path fileName = source.getFileName();
        String s = fileName != null ? fileName.toString() : source.toString();
        int dot = s.lastIndexOf('.');
        return dot > 0 ? s.substring(0, dot) : s;
    }
}
