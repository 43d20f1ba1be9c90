package com.example.mediagallery;

import com.example.mediagallery.metadata.ScanProgress;
import com.example.mediagallery.metadata.ScanResult;

/**
 * Observer of scan sessions. Callbacks run on the scan thread, in order; {@link #onFinished(ScanResult)}
 * is always the last call for a session. Implementations must not block for long.
 */
public interface ScanListener {

    default void onStarted(ScanSession session) {
    }

    default void onProgress(ScanProgress progress) {
    }

    default void onFinished(ScanResult result) {
    }
}
