package com.example.mediagallery.gallery;

import com.example.mediagallery.ScanListener;
import com.example.mediagallery.metadata.MediaRecord;
import com.example.mediagallery.metadata.ScanResult;
import com.example.mediagallery.store.MetadataStore;
import com.example.mediagallery.thumbnail.Thumbnail;
import com.example.mediagallery.thumbnail.ThumbnailCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Index-addressable view of the store for a virtualised list. Rows are read from an immutable snapshot
 * that {@link #refresh()} swaps atomically, so a render pass never sees a half-loaded index.
 *
 * <p>Registered as a {@link ScanListener}, it reloads itself whenever a scan finishes.
 */
public final class GalleryDataProvider implements ScanListener {
    private static final Logger LOGGER = LoggerFactory.getLogger(GalleryDataProvider.class);

    private final MetadataStore store;
    private final ThumbnailCache thumbnails;
    private volatile List<MediaRecord> rows = List.of();
    private volatile String folder;

    public GalleryDataProvider(MetadataStore store, ThumbnailCache thumbnails) {
        this.store = store;
        this.thumbnails = thumbnails;
    }

    public int rowCount() {
        return rows.size();
    }

    /**
     * @throws IndexOutOfBoundsException if {@code index} is outside {@code [0, rowCount())}
     */
    public MediaRecord rowAt(int index) {
        List<MediaRecord> current = rows;
        Objects.checkIndex(index, current.size());
        return current.get(index);
    }

    /**
     * The rows as of this call. Use it when a render pass needs the count and the rows to agree.
     */
    public List<MediaRecord> snapshot() {
        return rows;
    }

    public Thumbnail thumbnailFor(int index) {
        MediaRecord record = rowAt(index);
        return thumbnails.get(record.path(), record.fileType());
    }

    /**
     * Reloads from the store, keeping the current folder filter.
     */
    public synchronized void refresh() {
        String selected = folder;
        List<MediaRecord> loaded = selected == null ? store.loadAll() : store.loadUnder(selected);
        rows = List.copyOf(loaded);
        LOGGER.debug("Gallery reloaded with {} rows", loaded.size());
    }

    /**
     * Restricts the rows to records below {@code folder} and reloads.
     */
    public synchronized void showFolder(String folder) {
        this.folder = Objects.requireNonNull(folder, "folder");
        refresh();
    }

    public synchronized void showAll() {
        this.folder = null;
        refresh();
    }

    public Optional<String> currentFolder() {
        return Optional.ofNullable(folder);
    }

    public List<String> folders() {
        return store.folders();
    }

    @Override
    public void onFinished(ScanResult result) {
        refresh();
    }
}
