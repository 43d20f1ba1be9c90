package com.example.mediagallery.thumbnail;

import java.awt.image.BufferedImage;

/**
 * What a row should draw right now. Only {@link State#READY} images come from the file itself.
 */
public record Thumbnail(
        State state,
        BufferedImage image
) {
    public enum State {
        READY,
        PENDING,
        FAILED,
        GENERIC
    }

    public static Thumbnail ready(BufferedImage image) {
        return new Thumbnail(State.READY, image);
    }

    public boolean isReady() {
        return state == State.READY;
    }

    public boolean isPending() {
        return state == State.PENDING;
    }
}
