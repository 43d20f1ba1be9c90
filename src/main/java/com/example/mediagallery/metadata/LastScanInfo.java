package com.example.mediagallery.metadata;

import java.time.Instant;

/**
 * Summary of the most recent scan, kept across restarts for display.
 */
public record LastScanInfo(
        Instant timestamp,
        String root,
        ScanStatus status,
        long newFilesCount,
        long totalFilesScanned
) {
    public static LastScanInfo from(ScanResult result) {
        return new LastScanInfo(
                result.finishedAt(),
                result.root() == null ? null : result.root().toString(),
                result.status(),
                result.inserted(),
                result.attempted()
        );
    }
}
