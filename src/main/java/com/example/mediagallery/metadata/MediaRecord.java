package com.example.mediagallery.metadata;

import java.time.Instant;
import java.util.Locale;

/**
 * One persisted row per distinct file path. The path is the identity key.
 */
public record MediaRecord(
        String path,
        String filename,
        String extension,
        FileType fileType,
        String mimeType,
        long sizeBytes,
        Instant lastModified,
        Instant discoveredAt
) {
    /**
     * Returns the lower-case extension of a file name without the dot, or an empty string.
     */
    public static String extensionOf(String filename) {
        int dot = filename.lastIndexOf('.');
        if (dot <= 0 || dot == filename.length() - 1) {
            return "";
        }
        return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
