package com.example.mediagallery;

import com.example.mediagallery.metadata.DiscoveredFile;
import com.example.mediagallery.metadata.MediaRecord;
import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Instant;

/**
 * Turns a discovered file into the record that gets persisted.
 */
public class MediaRecordExtractor {
    private static final Logger LOGGER = LoggerFactory.getLogger(MediaRecordExtractor.class);

    private final Tika tika;
    private final Clock clock;

    public MediaRecordExtractor(Tika tika) {
        this(tika, Clock.systemUTC());
    }

    public MediaRecordExtractor(Tika tika, Clock clock) {
        this.tika = tika;
        this.clock = clock;
    }

    public MediaRecord extract(DiscoveredFile file) {
        Path path = file.path().toAbsolutePath().normalize();
        String filename = path.getFileName() == null ? path.toString() : path.getFileName().toString();
        long size = 0L;
        Instant modified = null;
        try {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            size = attributes.size();
            modified = attributes.lastModifiedTime().toInstant();
        } catch (IOException ex) {
            LOGGER.warn("Failed to read attributes for {}", path, ex);
        }
        return new MediaRecord(
                path.toString(),
                filename,
                MediaRecord.extensionOf(filename),
                file.fileType(),
                detectMimeType(filename),
                size,
                modified,
                clock.instant()
        );
    }

    // Name-based detection only; the walker already touched the file once.
    private String detectMimeType(String filename) {
        MediaType mediaType = MediaType.parse(tika.detect(filename));
        return mediaType == null ? MediaType.OCTET_STREAM.toString() : mediaType.toString();
    }
}
