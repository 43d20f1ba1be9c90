package com.example.mediagallery.metadata;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Final outcome of a scan session, delivered as the last notification of that session.
 */
public record ScanResult(
        Path root,
        ScanStatus status,
        long attempted,
        long inserted,
        long skipped,
        int walkFailures,
        String failureReason,
        Instant startedAt,
        Instant finishedAt
) {
}
