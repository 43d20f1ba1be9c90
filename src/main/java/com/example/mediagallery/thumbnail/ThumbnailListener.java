package com.example.mediagallery.thumbnail;

/**
 * Told when a previously pending thumbnail settled, so the row showing it can be redrawn.
 * Called on a decode thread.
 */
@FunctionalInterface
public interface ThumbnailListener {
    void onThumbnailReady(String path, Thumbnail thumbnail);
}
