package com.example.mediagallery;

import com.example.mediagallery.metadata.LastScanInfo;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

public final class LastScanStore {
    private final ObjectMapper mapper;
    private final Path file;

    /**
     * Keeps the summary of the most recent scan in a single JSON file.
     */
    public LastScanStore(Path file) {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.file = file;
    }

    /**
     * Returns the last saved summary if the file exists.
     */
    public Optional<LastScanInfo> load() throws IOException {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try (Reader reader = Files.newBufferedReader(file)) {
            return Optional.of(mapper.readValue(reader, LastScanInfo.class));
        }
    }

    /**
     * Replaces the saved summary, creating the parent directories if needed.
     */
    public void save(LastScanInfo info) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), info);
    }

    public Path path() {
        return file;
    }
}
