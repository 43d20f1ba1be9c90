package com.example.mediagallery;

import com.example.mediagallery.metadata.MediaExtensions;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.TreeSet;

public class ConfigLoader {
    static final String DEFAULT_DATABASE = "media.db";
    private static final String DEFAULT_LAST_SCAN_FILE = "last_scan.json";
    private static final int DEFAULT_THUMBNAIL_SIZE = 100;
    private static final int DEFAULT_THUMBNAIL_THREADS = 2;
    private static final long DEFAULT_PROGRESS_INTERVAL_MILLIS = 100L;
    private static final List<String> DEFAULT_EXCLUDE_FILES = List.of(
            "Thumbs.db",
            "desktop.ini",
            "ehthumbs.db",
            ".DS_Store"
    );
    private static final List<String> DEFAULT_EXCLUDE_DIRECTORIES = List.of(
            "$RECYCLE.BIN",
            "System Volume Information",
            ".thumbnails"
    );

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Reads a JSON config file. Missing fields fall back to defaults; a missing file yields the defaults
     * with the database placed next to where the file would be.
     */
    public GalleryConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            Path base = path.toAbsolutePath().getParent();
            return fromDefaults(base == null ? Path.of(DEFAULT_DATABASE) : base.resolve(DEFAULT_DATABASE));
        }
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);
        return fromRaw(raw);
    }

    /**
     * Writes the config back as JSON so edited extension sets survive a restart.
     */
    public void save(GalleryConfig config, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), toRaw(config));
    }

    GalleryConfig fromDefaults(Path databasePath) {
        RawConfig raw = new RawConfig();
        raw.databasePath = databasePath.toString();
        return fromRaw(raw);
    }

    private GalleryConfig fromRaw(RawConfig raw) {
        Path databasePath = Path.of(optionalString(raw.databasePath, DEFAULT_DATABASE));
        Path lastScanFile = raw.lastScanFile == null || raw.lastScanFile.isBlank()
                ? siblingOf(databasePath, DEFAULT_LAST_SCAN_FILE)
                : Path.of(raw.lastScanFile);
        int thumbnailSize = positiveOr(raw.thumbnailSize, DEFAULT_THUMBNAIL_SIZE);
        int thumbnailThreads = positiveOr(raw.thumbnailThreads, DEFAULT_THUMBNAIL_THREADS);
        long progressInterval = DEFAULT_PROGRESS_INTERVAL_MILLIS;
        if (raw.progressIntervalMillis != null) {
            if (raw.progressIntervalMillis < 0) {
                throw new IllegalArgumentException("progressIntervalMillis must not be negative.");
            }
            progressInterval = raw.progressIntervalMillis;
        }
        boolean followLinks = raw.followLinks != null && raw.followLinks;

        // A listed set replaces the default one so users can drop extensions they do not want.
        MediaExtensions extensions = new MediaExtensions(
                raw.imageExtensions == null ? MediaExtensions.DEFAULT_IMAGE_EXTENSIONS : new LinkedHashSet<>(raw.imageExtensions),
                raw.videoExtensions == null ? MediaExtensions.DEFAULT_VIDEO_EXTENSIONS : new LinkedHashSet<>(raw.videoExtensions)
        );

        List<String> excludeFilePatterns = mergePatterns(DEFAULT_EXCLUDE_FILES, raw.excludeFilePatterns);
        List<String> excludeDirectoryPatterns = mergePatterns(DEFAULT_EXCLUDE_DIRECTORIES, raw.excludeDirectoryPatterns);

        return new GalleryConfig(
                databasePath,
                lastScanFile,
                extensions,
                followLinks,
                excludeFilePatterns,
                excludeDirectoryPatterns,
                thumbnailSize,
                thumbnailThreads,
                progressInterval
        );
    }

    private RawConfig toRaw(GalleryConfig config) {
        RawConfig raw = new RawConfig();
        raw.databasePath = config.databasePath().toString();
        raw.lastScanFile = config.lastScanFile().toString();
        raw.imageExtensions = new ArrayList<>(new TreeSet<>(config.extensions().imageExtensions()));
        raw.videoExtensions = new ArrayList<>(new TreeSet<>(config.extensions().videoExtensions()));
        raw.followLinks = config.followLinks();
        raw.excludeFilePatterns = userPatterns(DEFAULT_EXCLUDE_FILES, config.excludeFilePatterns());
        raw.excludeDirectoryPatterns = userPatterns(DEFAULT_EXCLUDE_DIRECTORIES, config.excludeDirectoryPatterns());
        raw.thumbnailSize = config.thumbnailSize();
        raw.thumbnailThreads = config.thumbnailThreads();
        raw.progressIntervalMillis = config.progressIntervalMillis();
        return raw;
    }

    private List<String> mergePatterns(List<String> defaults, List<String> overrides) {
        List<String> merged = new ArrayList<>(defaults);
        if (overrides != null) {
            for (String pattern : overrides) {
                if (pattern == null || pattern.isBlank() || merged.contains(pattern)) {
                    continue;
                }
                merged.add(pattern);
            }
        }
        return List.copyOf(merged);
    }

    private List<String> userPatterns(List<String> defaults, List<String> patterns) {
        List<String> extra = new ArrayList<>();
        for (String pattern : patterns) {
            if (!defaults.contains(pattern)) {
                extra.add(pattern);
            }
        }
        return extra.isEmpty() ? null : extra;
    }

    private static Path siblingOf(Path file, String name) {
        Path parent = file.getParent();
        return parent == null ? Path.of(name) : parent.resolve(name);
    }

    private static int positiveOr(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public String databasePath;
        public String lastScanFile;
        public List<String> imageExtensions;
        public List<String> videoExtensions;
        public Boolean followLinks;
        public List<String> excludeFilePatterns;
        public List<String> excludeDirectoryPatterns;
        public Integer thumbnailSize;
        public Integer thumbnailThreads;
        public Long progressIntervalMillis;
    }
}
