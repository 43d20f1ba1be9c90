package com.example.mediagallery;

import com.example.mediagallery.metadata.FileType;
import com.example.mediagallery.metadata.MediaRecord;
import com.example.mediagallery.metadata.StoreStats;
import com.example.mediagallery.store.MetadataStore;
import com.example.mediagallery.store.MetadataStoreException;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Test double that can be told to fail for selected paths.
 */
public class InMemoryMetadataStore implements MetadataStore {
    private final Map<String, MediaRecord> records = new LinkedHashMap<>();
    private final Predicate<String> failOn;

    public InMemoryMetadataStore() {
        this(path -> false);
    }

    public InMemoryMetadataStore(Predicate<String> failOn) {
        this.failOn = failOn;
    }

    @Override
    public synchronized boolean upsert(MediaRecord record) {
        if (failOn.test(record.path())) {
            throw new MetadataStoreException("disk full", new IllegalStateException(record.path()));
        }
        return records.putIfAbsent(record.path(), record) == null;
    }

    @Override
    public synchronized List<MediaRecord> loadAll() {
        return new ArrayList<>(records.values());
    }

    @Override
    public synchronized Optional<MediaRecord> get(String path) {
        return Optional.ofNullable(records.get(path));
    }

    @Override
    public synchronized boolean exists(String path) {
        return records.containsKey(path);
    }

    @Override
    public synchronized long count() {
        return records.size();
    }

    @Override
    public synchronized List<MediaRecord> loadUnder(String folder) {
        String prefix = folder.endsWith(File.separator) ? folder : folder + File.separator;
        return records.values().stream().filter(record -> record.path().startsWith(prefix)).toList();
    }

    @Override
    public synchronized List<String> folders() {
        TreeSet<String> folders = new TreeSet<>();
        records.keySet().forEach(path -> folders.add(Path.of(path).getParent().toString()));
        return List.copyOf(folders);
    }

    @Override
    public synchronized int removeUnder(String folder) {
        List<MediaRecord> doomed = loadUnder(folder);
        doomed.forEach(record -> records.remove(record.path()));
        return doomed.size();
    }

    @Override
    public synchronized StoreStats stats() {
        return new StoreStats(
                records.size(),
                countOf(FileType.IMAGE),
                countOf(FileType.VIDEO),
                countOf(FileType.UNKNOWN),
                0L
        );
    }

    @Override
    public void compact() {
    }

    @Override
    public void close() {
    }

    private long countOf(FileType type) {
        return records.values().stream().filter(record -> record.fileType() == type).count();
    }
}
