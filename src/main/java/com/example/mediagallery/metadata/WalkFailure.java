package com.example.mediagallery.metadata;

import java.nio.file.Path;

/**
 * A directory or entry the walker could not read. The walk continues past it.
 */
public record WalkFailure(
        Path path,
        String reason
) {
}
