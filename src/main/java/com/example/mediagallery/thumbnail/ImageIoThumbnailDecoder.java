package com.example.mediagallery.thumbnail;

import com.example.mediagallery.metadata.ImageDetails;

import javax.imageio.IIOException;
import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;

/**
 * Decodes with whatever {@link ImageReader} ImageIO offers for the file, subsampling large sources
 * while reading so a full-resolution bitmap is never held.
 */
public class ImageIoThumbnailDecoder implements ThumbnailDecoder {

    @Override
    public BufferedImage decode(Path file, int maxSize) throws IOException {
        try (ImageInputStream input = open(file)) {
            ImageReader reader = readerFor(input, file);
            try {
                reader.setInput(input, true, true);
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);
                ImageReadParam param = reader.getDefaultReadParam();
                int subsampling = subsamplingFor(width, height, maxSize);
                if (subsampling > 1) {
                    param.setSourceSubsampling(subsampling, subsampling, 0, 0);
                }
                BufferedImage decoded = reader.read(0, param);
                if (decoded == null) {
                    throw new IIOException("Reader returned no image for " + file);
                }
                return scaleToFit(decoded, maxSize);
            } finally {
                reader.dispose();
            }
        }
    }

    /**
     * Reads resolution and format name from the image header only.
     */
    public ImageDetails details(Path file) throws IOException {
        try (ImageInputStream input = open(file)) {
            ImageReader reader = readerFor(input, file);
            try {
                reader.setInput(input, true, true);
                return new ImageDetails(
                        reader.getWidth(0),
                        reader.getHeight(0),
                        reader.getFormatName().toUpperCase(Locale.ROOT)
                );
            } finally {
                reader.dispose();
            }
        }
    }

    private static ImageInputStream open(Path file) throws IOException {
        ImageInputStream input = ImageIO.createImageInputStream(file.toFile());
        if (input == null) {
            throw new IIOException("Cannot open " + file);
        }
        return input;
    }

    private static ImageReader readerFor(ImageInputStream input, Path file) throws IIOException {
        Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
        if (!readers.hasNext()) {
            throw new IIOException("No image reader for " + file);
        }
        return readers.next();
    }

    // Keep at least twice the target resolution so the final smooth scale has detail to work with.
    static int subsamplingFor(int width, int height, int maxSize) {
        int longest = Math.max(width, height);
        return Math.max(1, longest / (maxSize * 2));
    }

    static BufferedImage scaleToFit(BufferedImage source, int maxSize) {
        int width = source.getWidth();
        int height = source.getHeight();
        double scale = Math.min(1.0, Math.min((double) maxSize / width, (double) maxSize / height));
        int targetWidth = Math.max(1, (int) Math.round(width * scale));
        int targetHeight = Math.max(1, (int) Math.round(height * scale));

        BufferedImage target = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = target.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(source, 0, 0, targetWidth, targetHeight, null);
        } finally {
            g.dispose();
        }
        return target;
    }
}
