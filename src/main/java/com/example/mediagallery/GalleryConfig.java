package com.example.mediagallery;

import com.example.mediagallery.metadata.MediaExtensions;

import java.nio.file.Path;
import java.util.List;

/**
 * Immutable runtime settings for indexing and thumbnailing.
 */
public record GalleryConfig(
        Path databasePath,
        Path lastScanFile,
        MediaExtensions extensions,
        boolean followLinks,
        List<String> excludeFilePatterns,
        List<String> excludeDirectoryPatterns,
        int thumbnailSize,
        int thumbnailThreads,
        long progressIntervalMillis
) {
    public static GalleryConfig defaults() {
        return new ConfigLoader().fromDefaults(Path.of(ConfigLoader.DEFAULT_DATABASE));
    }

    public GalleryConfig withExtensions(MediaExtensions updated) {
        return new GalleryConfig(
                databasePath,
                lastScanFile,
                updated,
                followLinks,
                excludeFilePatterns,
                excludeDirectoryPatterns,
                thumbnailSize,
                thumbnailThreads,
                progressIntervalMillis
        );
    }
}
