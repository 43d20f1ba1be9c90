package com.example.mediagallery;

import com.example.mediagallery.metadata.FileType;
import com.example.mediagallery.metadata.MediaExtensions;
import com.example.mediagallery.metadata.MediaRecord;

import java.nio.file.Path;

/**
 * Maps file extensions to a {@link FileType}. Stateless apart from the configured extension sets;
 * unrecognised extensions are {@link FileType#UNKNOWN}, never an error.
 */
public final class MediaClassifier {
    private final MediaExtensions extensions;

    public MediaClassifier(MediaExtensions extensions) {
        this.extensions = extensions;
    }

    /**
     * Classifies an extension, matched case-insensitively, with or without a leading dot.
     */
    public FileType classify(String extension) {
        String normalized = MediaExtensions.normalize(extension);
        if (normalized.isEmpty()) {
            return FileType.UNKNOWN;
        }
        if (extensions.imageExtensions().contains(normalized)) {
            return FileType.IMAGE;
        }
        if (extensions.videoExtensions().contains(normalized)) {
            return FileType.VIDEO;
        }
        return FileType.UNKNOWN;
    }

    public FileType classify(Path file) {
        Path name = file.getFileName();
        return name == null ? FileType.UNKNOWN : classify(MediaRecord.extensionOf(name.toString()));
    }
}
