package com.example.mediagallery;

import java.nio.file.Path;

/**
 * Thrown by {@link ScanCoordinator#startScan(Path)} while another session is active. Retry once the
 * active session has finished.
 */
public class ScanAlreadyRunningException extends IllegalStateException {
    private final Path activeRoot;

    public ScanAlreadyRunningException(Path activeRoot) {
        super("A scan of " + activeRoot + " is already running.");
        this.activeRoot = activeRoot;
    }

    public Path activeRoot() {
        return activeRoot;
    }
}
