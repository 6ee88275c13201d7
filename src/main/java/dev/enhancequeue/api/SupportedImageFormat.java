package dev.enhancequeue.api;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Input formats accepted for enhancement, matched by file extension.
 */
public enum SupportedImageFormat {
    JPEG("JPEG", false, "jpg", "jpeg"),
    PNG("PNG", true, "png"),
    HEIC("HEIC", true, "heic", "heif"),
    BMP("BMP", true, "bmp"),
    TIFF("TIFF", true, "tiff", "tif"),
    WEBP("WebP", false, "webp");

    private final String displayName;
    private final boolean lossless;
    private final List<String> extensions;

    SupportedImageFormat(String displayName, boolean lossless, String... extensions) {
        this.displayName = displayName;
        this.lossless = lossless;
        this.extensions = List.of(extensions);
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Lossless sources are re-encoded losslessly; lossy ones at a fixed quality.
     */
    public boolean isLossless() {
        return lossless;
    }

    public List<String> extensions() {
        return extensions;
    }

    public static Optional<SupportedImageFormat> fromExtension(String extension) {
        if (extension == null) {
            return Optional.empty();
        }
        String ext = extension.toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(f -> f.extensions.contains(ext)).findFirst();
    }

    public static Optional<SupportedImageFormat> of(Path path) {
        return fromExtension(extensionOf(path));
    }

    public static List<String> allExtensions() {
        return Arrays.stream(values()).flatMap(f -> f.extensions.stream()).collect(Collectors.toList());
    }

    public static String supportedFormatsString() {
        return Arrays.stream(values()).map(SupportedImageFormat::displayName).collect(Collectors.joining(", "));
    }

    /**
     * @return the lowercase extension without the dot, or "" when the file name has none
     */
    public static String extensionOf(Path path) {
        Path name = path.getFileName();
        if (name == null) {
            return "";
        }
        String s = name.toString();
        int dot = s.lastIndexOf('.');
        return (dot <= 0 || dot == s.length() - 1) ? "" : s.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
