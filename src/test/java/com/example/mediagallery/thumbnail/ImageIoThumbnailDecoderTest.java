package com.example.mediagallery.thumbnail;

import com.example.mediagallery.metadata.ImageDetails;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ImageIoThumbnailDecoderTest {
    @TempDir
    Path tempDir;

    private final ImageIoThumbnailDecoder decoder = new ImageIoThumbnailDecoder();

    @Test
    void shrinksTallImageKeepingAspectRatio() throws IOException {
        Path file = tempDir.resolve("tall.png");
        ImageIO.write(new BufferedImage(300, 900, BufferedImage.TYPE_INT_RGB), "png", file.toFile());

        BufferedImage thumbnail = decoder.decode(file, 90);

        assertEquals(30, thumbnail.getWidth());
        assertEquals(90, thumbnail.getHeight());
    }

    @Test
    void neverUpscalesSmallImages() throws IOException {
        Path file = tempDir.resolve("icon.png");
        ImageIO.write(new BufferedImage(16, 12, BufferedImage.TYPE_INT_RGB), "png", file.toFile());

        BufferedImage thumbnail = decoder.decode(file, 100);

        assertEquals(16, thumbnail.getWidth());
        assertEquals(12, thumbnail.getHeight());
    }

    @Test
    void rejectsFilesThatAreNotImages() throws IOException {
        Path file = Files.writeString(tempDir.resolve("fake.jpg"), "not really a jpeg");

        assertThrows(IOException.class, () -> decoder.decode(file, 100));
    }

    @Test
    void readsResolutionAndFormatFromHeader() throws IOException {
        Path file = tempDir.resolve("landscape.png");
        ImageIO.write(new BufferedImage(320, 240, BufferedImage.TYPE_INT_RGB), "png", file.toFile());

        ImageDetails details = decoder.details(file);

        assertEquals(320, details.width());
        assertEquals(240, details.height());
        assertEquals("PNG", details.formatName());
        assertEquals(4.0 / 3.0, details.aspectRatio(), 0.001);
    }

    @Test
    void detailsOfNonImageFail() throws IOException {
        Path file = Files.writeString(tempDir.resolve("notes.png"), "plain text");

        assertThrows(IOException.class, () -> decoder.details(file));
    }

    @Test
    void subsamplesOnlyWellAboveTargetSize() {
        assertEquals(1, ImageIoThumbnailDecoder.subsamplingFor(150, 100, 100));
        assertEquals(1, ImageIoThumbnailDecoder.subsamplingFor(399, 10, 100));
        assertEquals(4, ImageIoThumbnailDecoder.subsamplingFor(10, 800, 100));
    }
}
