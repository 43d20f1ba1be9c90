package com.example.mediagallery.metadata;

import java.nio.file.Path;

/**
 * A regular file found by the walker, identified by its real absolute path.
 */
public record DiscoveredFile(
        Path path,
        FileType fileType
) {
}
