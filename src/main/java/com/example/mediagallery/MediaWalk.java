package com.example.mediagallery;

import com.example.mediagallery.metadata.DiscoveredFile;
import com.example.mediagallery.metadata.WalkFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A single breadth-first traversal. Directories are listed lazily, one at a time, as the consumer
 * pulls files; entries of a directory are visited in file-name order. Not thread-safe.
 */
public final class MediaWalk implements Iterator<DiscoveredFile> {
    private static final Logger LOGGER = LoggerFactory.getLogger(MediaWalk.class);

    private final MediaWalker walker;
    private final Path root;
    private final Deque<Path> pendingDirectories = new ArrayDeque<>();
    private final Deque<DiscoveredFile> ready = new ArrayDeque<>();
    // Real paths of directories already listed; guards against link cycles.
    private final Set<Path> visited = new HashSet<>();
    private final List<WalkFailure> failures = new ArrayList<>();

    MediaWalk(MediaWalker walker, Path root) {
        this.walker = walker;
        this.root = root;
        pendingDirectories.addLast(root);
    }

    public Path root() {
        return root;
    }

    @Override
    public boolean hasNext() {
        while (ready.isEmpty() && !pendingDirectories.isEmpty()) {
            scanDirectory(pendingDirectories.removeFirst());
        }
        return !ready.isEmpty();
    }

    @Override
    public DiscoveredFile next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return ready.removeFirst();
    }

    public Stream<DiscoveredFile> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL),
                false
        );
    }

    /**
     * Entries that could not be read so far. Grows as the walk advances.
     */
    public List<WalkFailure> failures() {
        return List.copyOf(failures);
    }

    private void scanDirectory(Path directory) {
        Path realDirectory;
        try {
            realDirectory = directory.toRealPath();
        } catch (IOException ex) {
            recordFailure(directory, ex);
            return;
        }
        if (!visited.add(realDirectory)) {
            LOGGER.debug("Skipping {}; {} was already visited", directory, realDirectory);
            return;
        }

        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = walker.openDirectory(directory)) {
            for (Path entry : stream) {
                entries.add(entry);
            }
        } catch (DirectoryIteratorException ex) {
            // Entries read before the error are still walked.
            recordListingFailure(directory, ex.getCause());
        } catch (IOException ex) {
            recordListingFailure(directory, ex);
            return;
        }
        entries.sort(Comparator.comparing(entry -> entry.getFileName().toString()));

        for (Path entry : entries) {
            boolean link = Files.isSymbolicLink(entry);
            if (link && !walker.followLinks()) {
                continue;
            }
            if (Files.isDirectory(entry)) {
                if (!walker.isExcludedDirectory(entry)) {
                    pendingDirectories.addLast(entry);
                }
            } else if (Files.isRegularFile(entry)) {
                if (!walker.isExcludedFile(entry)) {
                    addFile(entry);
                }
            } else if (link) {
                failures.add(new WalkFailure(entry, "broken symbolic link"));
                LOGGER.warn("Skipping broken symbolic link {}", entry);
            }
        }
    }

    private void addFile(Path entry) {
        Path realFile;
        try {
            realFile = entry.toRealPath();
        } catch (IOException ex) {
            recordFailure(entry, ex);
            return;
        }
        ready.addLast(new DiscoveredFile(realFile, walker.classifier().classify(realFile)));
    }

    private void recordListingFailure(Path directory, IOException ex) {
        LOGGER.warn("Failed to list directory {}", directory, ex);
        failures.add(new WalkFailure(directory, describe(ex)));
    }

    private void recordFailure(Path path, IOException ex) {
        LOGGER.warn("Failed to resolve {}", path, ex);
        failures.add(new WalkFailure(path, describe(ex)));
    }

    private static String describe(IOException ex) {
        String message = ex.getMessage();
        return ex.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
