package com.example.mediagallery.thumbnail;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

@FunctionalInterface
public interface ThumbnailDecoder {
    /**
     * Decodes {@code file} and scales it to fit a {@code maxSize} square, keeping the aspect ratio.
     *
     * @throws IOException if the file cannot be read or is not a decodable image
     */
    BufferedImage decode(Path file, int maxSize) throws IOException;
}
