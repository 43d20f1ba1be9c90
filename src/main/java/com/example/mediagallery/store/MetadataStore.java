package com.example.mediagallery.store;

import com.example.mediagallery.metadata.MediaRecord;
import com.example.mediagallery.metadata.StoreStats;

import java.util.List;
import java.util.Optional;

/**
 * Durable, path-keyed store of media records. Implementations must be safe for concurrent use from the
 * scan thread and from lookups on other threads.
 */
public interface MetadataStore extends AutoCloseable {

    /**
     * Inserts the record if no record with the same path exists. A duplicate path is not an error.
     *
     * @return true if a new row was written, false if the path was already present
     */
    boolean upsert(MediaRecord record);

    /**
     * All records, oldest discovery first.
     */
    List<MediaRecord> loadAll();

    Optional<MediaRecord> get(String path);

    boolean exists(String path);

    long count();

    /**
     * Records located anywhere below {@code folder}.
     */
    List<MediaRecord> loadUnder(String folder);

    /**
     * Sorted distinct parent directories of every stored record.
     */
    List<String> folders();

    /**
     * Forgets every record below {@code folder}.
     *
     * @return the number of records removed
     */
    int removeUnder(String folder);

    StoreStats stats();

    /**
     * Reclaims free pages in the backing file.
     */
    void compact();

    @Override
    void close();
}
