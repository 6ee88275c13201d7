package dev.enhancequeue.ser;

import dev.enhancequeue.api.ImageDimensions;
import dev.enhancequeue.testing.TestImages;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ImageCodecTest {

    @Test
    void costIsFourBytesPerPixel() {
        assertEquals(30L * 20 * 4, ImageCodec.estimateCost(TestImages.image(30, 20)));
    }

    @Test
    void jpegEncoding_flattensAlpha() throws Exception {
        BufferedImage argb = new BufferedImage(12, 7, BufferedImage.TYPE_INT_ARGB);
        byte[] jpeg = ImageCodec.encodeJpeg(argb, 0.85f);
        BufferedImage decoded = ImageCodec.decode(jpeg);
        assertEquals(12, decoded.getWidth());
        assertEquals(7, decoded.getHeight());
        assertFalse(decoded.getColorModel().hasAlpha());
    }

    @Test
    void readDimensions_readsHeaderOnly() throws Exception {
        byte[] png = TestImages.png(33, 17);
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(png))) {
            Optional<ImageDimensions> dims = ImageCodec.readDimensions(in);
            assertEquals(Optional.of(new ImageDimensions(33, 17)), dims);
        }
    }

    @Test
    void garbage_isRejected() throws Exception {
        assertThrows(IOException.class, () -> ImageCodec.decode(new byte[0]));
        assertThrows(IOException.class, () -> ImageCodec.decode("not an image".getBytes()));
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream("nope".getBytes()))) {
            assertTrue(ImageCodec.readDimensions(in).isEmpty());
        }
    }

    @Test
    void qualityOutOfRange_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> ImageCodec.encodeJpeg(TestImages.image(2, 2), 1.5f));
    }
}
