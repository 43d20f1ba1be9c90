package com.example.mediagallery.metadata;

/**
 * Resolution and format of an image, read from its header without decoding pixels.
 */
public record ImageDetails(
        int width,
        int height,
        String formatName
) {
    /**
     * Width divided by height, or 0 when the height is unknown.
     */
    public double aspectRatio() {
        return height > 0 ? (double) width / height : 0.0;
    }
}
