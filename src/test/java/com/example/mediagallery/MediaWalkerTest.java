package com.example.mediagallery;

import com.example.mediagallery.metadata.DiscoveredFile;
import com.example.mediagallery.metadata.FileType;
import com.example.mediagallery.metadata.MediaExtensions;
import com.example.mediagallery.metadata.WalkFailure;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

class MediaWalkerTest {
    @TempDir
    Path root;

    private static MediaWalker walker(boolean followLinks) {
        return new MediaWalker(
                new MediaClassifier(MediaExtensions.defaults()),
                followLinks,
                List.of("Thumbs.db"),
                List.of(".thumbnails")
        );
    }

    @Test
    void emitsEveryRegularFileIncludingUnknownTypes() throws Exception {
        Files.writeString(root.resolve("a.jpg"), "a");
        Files.writeString(root.resolve("b.mp4"), "b");
        Files.writeString(root.resolve("c.txt"), "c");
        Path sub = Files.createDirectory(root.resolve("sub"));
        Files.writeString(sub.resolve("d.PNG"), "d");

        Map<String, FileType> found = walker(false).walk(root).stream()
                .collect(Collectors.toMap(file -> file.path().getFileName().toString(), DiscoveredFile::fileType));

        assertEquals(Map.of(
                "a.jpg", FileType.IMAGE,
                "b.mp4", FileType.VIDEO,
                "c.txt", FileType.UNKNOWN,
                "d.PNG", FileType.IMAGE
        ), found);
    }

    @Test
    void walksBreadthFirstInNameOrderAndIsRepeatable() throws Exception {
        Path z = Files.createDirectory(root.resolve("z"));
        Path a = Files.createDirectory(root.resolve("a"));
        Files.writeString(z.resolve("1.jpg"), "1");
        Files.writeString(a.resolve("2.jpg"), "2");
        Files.writeString(root.resolve("b.jpg"), "b");
        Files.writeString(root.resolve("a.jpg"), "a");

        MediaWalker walker = walker(false);
        List<String> first = names(walker.walk(root));
        List<String> second = names(walker.walk(root));

        assertEquals(List.of("a.jpg", "b.jpg", "2.jpg", "1.jpg"), first);
        assertEquals(first, second);
    }

    @Test
    void reportsRealPathsForLinkedFiles() throws Exception {
        Path original = Files.writeString(root.resolve("a.jpg"), "a");
        Path sub = Files.createDirectory(root.resolve("sub"));
        Files.createSymbolicLink(sub.resolve("a.jpg"), original);

        Path real = original.toRealPath();

        List<DiscoveredFile> files = walker(true).walk(root).stream().toList();

        assertEquals(2, files.size());
        assertTrue(files.stream().allMatch(file -> file.path().equals(real)));
    }

    @Test
    void skipsLinksUnlessFollowingThem() throws Exception {
        Path original = Files.writeString(root.resolve("a.jpg"), "a");
        Files.createSymbolicLink(root.resolve("link.jpg"), original);

        assertEquals(List.of("a.jpg"), names(walker(false).walk(root)));
    }

    @Test
    void visitsEachDirectoryOnceDespiteLinkCycles() throws Exception {
        Path sub = Files.createDirectory(root.resolve("sub"));
        Files.writeString(sub.resolve("photo.jpg"), "p");
        Files.createSymbolicLink(sub.resolve("loop"), root);
        Files.createSymbolicLink(root.resolve("again"), sub);

        List<String> found = names(walker(true).walk(root));

        assertEquals(List.of("photo.jpg"), found);
    }

    @Test
    void appliesExclusionPatterns() throws Exception {
        Files.writeString(root.resolve("Thumbs.db"), "x");
        Path hidden = Files.createDirectory(root.resolve(".thumbnails"));
        Files.writeString(hidden.resolve("cached.jpg"), "x");
        Files.writeString(root.resolve("kept.gif"), "x");

        assertEquals(List.of("kept.gif"), names(walker(false).walk(root)));
    }

    @Test
    void recordsUnreadableDirectoriesAndContinues() throws Exception {
        Path locked = Files.createDirectory(root.resolve("locked"));
        Files.writeString(locked.resolve("secret.jpg"), "s");
        Path open = Files.createDirectory(root.resolve("open"));
        Files.writeString(open.resolve("visible.jpg"), "v");
        Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("---------"));
        try {
            assumeFalse(Files.isReadable(locked), "permissions are not enforced for this user");

            MediaWalk walk = walker(false).walk(root);
            List<String> found = names(walk);

            assertEquals(List.of("visible.jpg"), found);
            List<WalkFailure> failures = walk.failures();
            assertEquals(1, failures.size());
            assertEquals(locked, failures.get(0).path());
        } finally {
            Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("rwx------"));
        }
    }

    @Test
    void recordsBrokenLinks() throws Exception {
        Files.createSymbolicLink(root.resolve("dangling.jpg"), root.resolve("missing.jpg"));
        Files.writeString(root.resolve("ok.jpg"), "o");

        MediaWalk walk = walker(true).walk(root);

        assertEquals(List.of("ok.jpg"), names(walk));
        assertEquals(1, walk.failures().size());
    }

    @Test
    void rejectsMissingRootAndFileRoot() throws Exception {
        Path file = Files.writeString(root.resolve("a.jpg"), "a");

        assertThrows(NoSuchFileException.class, () -> walker(false).walk(root.resolve("nope")));
        assertThrows(NotDirectoryException.class, () -> walker(false).walk(file));
    }

    @Test
    void listingErrorMidDirectoryKeepsEarlierEntriesAndContinues() throws Exception {
        Files.writeString(root.resolve("a.jpg"), "a");
        Path flaky = Files.createDirectory(root.resolve("flaky"));
        Path first = Files.writeString(flaky.resolve("one.jpg"), "1");
        Files.writeString(flaky.resolve("two.jpg"), "2");
        Path later = Files.createDirectory(root.resolve("later"));
        Files.writeString(later.resolve("three.jpg"), "3");
        MediaWalker walker = new MediaWalker(
                new MediaClassifier(MediaExtensions.defaults()),
                false,
                List.of(),
                List.of(),
                directory -> directory.getFileName().toString().equals("flaky")
                        ? failingAfter(List.of(first))
                        : Files.newDirectoryStream(directory)
        );

        MediaWalk walk = walker.walk(root);

        assertEquals(List.of("a.jpg", "one.jpg", "three.jpg"), names(walk));
        List<WalkFailure> failures = walk.failures();
        assertEquals(1, failures.size());
        assertEquals(root.toRealPath().resolve("flaky"), failures.get(0).path());
        assertTrue(failures.get(0).reason().contains("device went away"));
    }

    @Test
    void startsFromTheRealPathOfALinkedRoot() throws Exception {
        Path real = Files.createDirectory(root.resolve("real"));
        Files.writeString(real.resolve("a.jpg"), "a");
        Path linked = Files.createSymbolicLink(root.resolve("Pictures"), real);

        MediaWalk walk = walker(false).walk(linked);

        assertEquals(real.toRealPath(), walk.root());
        assertEquals(real.toRealPath().resolve("a.jpg"), walk.next().path());
    }

    @Test
    void emptyTreeYieldsNothing() throws Exception {
        MediaWalk walk = walker(false).walk(root);

        assertFalse(walk.hasNext());
        assertTrue(walk.failures().isEmpty());
    }

    private static DirectoryStream<Path> failingAfter(List<Path> entries) {
        return new DirectoryStream<>() {
            @Override
            public Iterator<Path> iterator() {
                Iterator<Path> delegate = entries.iterator();
                return new Iterator<>() {
                    @Override
                    public boolean hasNext() {
                        return true;
                    }

                    @Override
                    public Path next() {
                        if (delegate.hasNext()) {
                            return delegate.next();
                        }
                        throw new DirectoryIteratorException(new IOException("device went away"));
                    }
                };
            }

            @Override
            public void close() {
            }
        };
    }

    private static List<String> names(MediaWalk walk) {
        return walk.stream().map(file -> file.path().getFileName().toString()).toList();
    }
}
