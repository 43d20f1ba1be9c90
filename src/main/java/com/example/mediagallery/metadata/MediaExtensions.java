package com.example.mediagallery.metadata;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * The two extension sets used to classify files. Extensions are kept lower case and without a leading dot.
 */
public record MediaExtensions(
        Set<String> imageExtensions,
        Set<String> videoExtensions
) {
    public static final Set<String> DEFAULT_IMAGE_EXTENSIONS = Set.of(
            "jpg", "jpeg", "png", "bmp", "gif", "webp", "tiff", "tif",
            "svg", "heic", "ico", "raw", "cr2", "nef", "orf", "sr2"
    );
    public static final Set<String> DEFAULT_VIDEO_EXTENSIONS = Set.of(
            "mp4", "mkv", "avi", "mov", "wmv", "flv",
            "mpg", "mpeg", "m4v", "3gp", "webm", "ts", "mts", "m2ts"
    );

    public MediaExtensions {
        imageExtensions = normalizeAll(imageExtensions);
        videoExtensions = normalizeAll(videoExtensions);
    }

    public static MediaExtensions defaults() {
        return new MediaExtensions(DEFAULT_IMAGE_EXTENSIONS, DEFAULT_VIDEO_EXTENSIONS);
    }

    /**
     * Returns a copy with {@code extension} added to the set for {@code type}.
     */
    public MediaExtensions withExtension(FileType type, String extension) {
        String normalized = requireValid(extension);
        return switch (type) {
            case IMAGE -> new MediaExtensions(plus(imageExtensions, normalized), videoExtensions);
            case VIDEO -> new MediaExtensions(imageExtensions, plus(videoExtensions, normalized));
            case UNKNOWN -> throw new IllegalArgumentException("Extensions can only be registered for images or videos.");
        };
    }

    /**
     * Returns a copy with {@code extension} removed from the set for {@code type}.
     */
    public MediaExtensions withoutExtension(FileType type, String extension) {
        String normalized = requireValid(extension);
        return switch (type) {
            case IMAGE -> new MediaExtensions(minus(imageExtensions, normalized), videoExtensions);
            case VIDEO -> new MediaExtensions(imageExtensions, minus(videoExtensions, normalized));
            case UNKNOWN -> throw new IllegalArgumentException("Extensions can only be removed from images or videos.");
        };
    }

    public static String normalize(String extension) {
        if (extension == null) {
            return "";
        }
        String trimmed = extension.trim().toLowerCase(Locale.ROOT);
        while (trimmed.startsWith(".")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed;
    }

    private static String requireValid(String extension) {
        String normalized = normalize(extension);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Extension must not be blank.");
        }
        return normalized;
    }

    private static Set<String> normalizeAll(Collection<String> extensions) {
        Set<String> normalized = new LinkedHashSet<>();
        if (extensions != null) {
            for (String extension : extensions) {
                String value = normalize(extension);
                if (!value.isEmpty()) {
                    normalized.add(value);
                }
            }
        }
        return Set.copyOf(normalized);
    }

    private static Set<String> plus(Set<String> source, String value) {
        Set<String> copy = new LinkedHashSet<>(source);
        copy.add(value);
        return copy;
    }

    private static Set<String> minus(Set<String> source, String value) {
        Set<String> copy = new LinkedHashSet<>(source);
        copy.remove(value);
        return copy;
    }
}
