package com.example.mediagallery;

import com.example.mediagallery.metadata.DiscoveredFile;
import com.example.mediagallery.metadata.FileType;
import com.example.mediagallery.metadata.MediaRecord;
import org.apache.tika.Tika;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class MediaRecordExtractorTest {
    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    @TempDir
    Path dir;

    private final MediaRecordExtractor extractor =
            new MediaRecordExtractor(new Tika(), Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void derivesDisplayFieldsAndMimeType() throws Exception {
        Path photo = dir.resolve("Holiday.Beach.jpg");
        Files.write(photo, new byte[]{1, 2, 3, 4, 5});

        MediaRecord record = extractor.extract(new DiscoveredFile(photo, FileType.IMAGE));

        assertEquals(photo.toAbsolutePath().toString(), record.path());
        assertEquals("Holiday.Beach.jpg", record.filename());
        assertEquals("jpg", record.extension());
        assertEquals(FileType.IMAGE, record.fileType());
        assertEquals("image/jpeg", record.mimeType());
        assertEquals(5L, record.sizeBytes());
        assertNotNull(record.lastModified());
        assertEquals(NOW, record.discoveredAt());
    }

    @Test
    void toleratesFilesThatVanished() {
        Path gone = dir.resolve("gone.mp4");

        MediaRecord record = extractor.extract(new DiscoveredFile(gone, FileType.VIDEO));

        assertEquals(0L, record.sizeBytes());
        assertNull(record.lastModified());
        assertEquals("mp4", record.extension());
    }
}
