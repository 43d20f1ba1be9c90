package com.example.mediagallery.metadata;

import java.nio.file.Path;

/**
 * Progress after an upsert attempt. Counts are cumulative for the session.
 */
public record ScanProgress(
        Path root,
        Path currentPath,
        long attempted,
        long inserted,
        long skipped
) {
}
