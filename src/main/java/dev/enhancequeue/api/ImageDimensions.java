package dev.enhancequeue.api;

/**
 * Pixel size of an image, as read from its header.
 */
public record ImageDimensions(int width, int height) {
    public ImageDimensions {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("dimensions must be non-negative: " + width + "x" + height);
        }
    }

    public boolean exceeds(int maxDimension) {
        return width > maxDimension || height > maxDimension;
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
