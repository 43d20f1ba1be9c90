package com.example.mediagallery;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;

/**
 * Enumerates a directory tree and classifies every regular file in it. Each call to {@link #walk(Path)}
 * is an independent traversal; the walker itself holds configuration only.
 */
public final class MediaWalker {
    private final MediaClassifier classifier;
    private final boolean followLinks;
    private final List<PathMatcher> excludedFiles;
    private final List<PathMatcher> excludedDirectories;
    private final DirectoryOpener opener;

    public MediaWalker(GalleryConfig config) {
        this(
                new MediaClassifier(config.extensions()),
                config.followLinks(),
                config.excludeFilePatterns(),
                config.excludeDirectoryPatterns()
        );
    }

    public MediaWalker(MediaClassifier classifier,
                       boolean followLinks,
                       List<String> excludeFilePatterns,
                       List<String> excludeDirectoryPatterns) {
        this(classifier, followLinks, excludeFilePatterns, excludeDirectoryPatterns, Files::newDirectoryStream);
    }

    MediaWalker(MediaClassifier classifier,
                boolean followLinks,
                List<String> excludeFilePatterns,
                List<String> excludeDirectoryPatterns,
                DirectoryOpener opener) {
        this.classifier = classifier;
        this.opener = opener;
        this.followLinks = followLinks;
        this.excludedFiles = compile(excludeFilePatterns);
        this.excludedDirectories = compile(excludeDirectoryPatterns);
    }

    /**
     * Opens a traversal of {@code root}. Fails immediately if the root is missing, is not a directory
     * or cannot be read; everything below the root is reported through {@link MediaWalk#failures()}.
     * The walk starts from the real path of the root, the same form files are reported in.
     */
    public MediaWalk walk(Path root) throws IOException {
        Path start = root.toAbsolutePath().normalize();
        BasicFileAttributes attrs = Files.readAttributes(start, BasicFileAttributes.class);
        if (!attrs.isDirectory()) {
            throw new NotDirectoryException(start.toString());
        }
        if (!Files.isReadable(start)) {
            throw new AccessDeniedException(start.toString());
        }
        return new MediaWalk(this, start.toRealPath());
    }

    MediaClassifier classifier() {
        return classifier;
    }

    DirectoryStream<Path> openDirectory(Path directory) throws IOException {
        return opener.open(directory);
    }

    boolean followLinks() {
        return followLinks;
    }

    boolean isExcludedFile(Path entry) {
        return matches(excludedFiles, entry);
    }

    boolean isExcludedDirectory(Path entry) {
        return matches(excludedDirectories, entry);
    }

    private static boolean matches(List<PathMatcher> matchers, Path entry) {
        Path name = entry.getFileName();
        if (name == null) {
            return false;
        }
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(name)) {
                return true;
            }
        }
        return false;
    }

    @FunctionalInterface
    interface DirectoryOpener {
        DirectoryStream<Path> open(Path directory) throws IOException;
    }

    private static List<PathMatcher> compile(List<String> patterns) {
        return patterns.stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();
    }
}
