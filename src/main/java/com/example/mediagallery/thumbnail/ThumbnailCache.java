package com.example.mediagallery.thumbnail;

import com.example.mediagallery.GalleryConfig;
import com.example.mediagallery.metadata.FileType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lazily decoded, memoised thumbnails keyed by file path.
 *
 * <p>{@link #get(String, FileType)} never blocks on I/O: a miss schedules a decode on the cache's own
 * pool and answers with a pending placeholder. Concurrent misses for one path share a single decode.
 * A failed decode is remembered too, so the file is not retried each time it scrolls into view.
 *
 * <p>Entries are never evicted; the cache grows with the number of distinct images requested during
 * the life of the process.
 */
public final class ThumbnailCache implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ThumbnailCache.class);

    private final ThumbnailDecoder decoder;
    private final int maxSize;
    private final ExecutorService executor;
    private final Thumbnail pending;
    private final Thumbnail failed;
    private final Thumbnail video;
    private final Thumbnail file;
    private final List<ThumbnailListener> listeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();
    // Both maps are guarded by lock; a path is in at most one of them.
    private final Map<String, Thumbnail> entries = new HashMap<>();
    private final Map<String, CompletableFuture<Thumbnail>> inFlight = new HashMap<>();

    public ThumbnailCache(GalleryConfig config) {
        this(new ImageIoThumbnailDecoder(), config.thumbnailSize(), config.thumbnailThreads());
    }

    public ThumbnailCache(ThumbnailDecoder decoder, int maxSize, int threads) {
        if (maxSize <= 0 || threads <= 0) {
            throw new IllegalArgumentException("Thumbnail size and thread count must be positive.");
        }
        this.decoder = decoder;
        this.maxSize = maxSize;
        PlaceholderImages placeholders = new PlaceholderImages(maxSize);
        this.pending = new Thumbnail(Thumbnail.State.PENDING, placeholders.pending());
        this.failed = new Thumbnail(Thumbnail.State.FAILED, placeholders.failed());
        this.video = new Thumbnail(Thumbnail.State.GENERIC, placeholders.video());
        this.file = new Thumbnail(Thumbnail.State.GENERIC, placeholders.file());
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "thumbnail-" + counter.incrementAndGet());
            thread.setDaemon(true);
            thread.setPriority(Thread.MIN_PRIORITY);
            return thread;
        });
    }

    /**
     * Returns the cached thumbnail, a generic icon for non-images, or the pending placeholder while a
     * decode runs in the background.
     */
    public Thumbnail get(String path, FileType fileType) {
        CompletableFuture<Thumbnail> future = request(path, fileType);
        if (future.isDone() && !future.isCompletedExceptionally()) {
            return future.join();
        }
        return pending;
    }

    /**
     * Like {@link #get(String, FileType)} but hands back the eventual result. The future completes
     * exceptionally only if the cache was closed before the decode could be scheduled.
     */
    public CompletableFuture<Thumbnail> request(String path, FileType fileType) {
        if (fileType == FileType.VIDEO) {
            return CompletableFuture.completedFuture(video);
        }
        if (fileType != FileType.IMAGE) {
            return CompletableFuture.completedFuture(file);
        }
        synchronized (lock) {
            Thumbnail cached = entries.get(path);
            if (cached != null) {
                return CompletableFuture.completedFuture(cached);
            }
            CompletableFuture<Thumbnail> running = inFlight.get(path);
            if (running != null) {
                return running;
            }
            CompletableFuture<Thumbnail> future = new CompletableFuture<>();
            inFlight.put(path, future);
            try {
                executor.execute(() -> decode(path, future));
            } catch (RejectedExecutionException ex) {
                inFlight.remove(path);
                future.completeExceptionally(new IllegalStateException("Thumbnail cache is closed.", ex));
            }
            return future;
        }
    }

    public void addListener(ThumbnailListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ThumbnailListener listener) {
        listeners.remove(listener);
    }

    public boolean isCached(String path) {
        synchronized (lock) {
            return entries.containsKey(path);
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public int inFlightCount() {
        synchronized (lock) {
            return inFlight.size();
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOGGER.warn("Thumbnail decoders did not stop within 5 seconds");
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while stopping thumbnail decoders.", ex);
        }
    }

    private void decode(String path, CompletableFuture<Thumbnail> future) {
        Thumbnail result;
        try {
            BufferedImage image = decoder.decode(Path.of(path), maxSize);
            result = image == null ? failed : Thumbnail.ready(image);
        } catch (IOException | RuntimeException ex) {
            LOGGER.warn("Failed to decode thumbnail for {}", path, ex);
            result = failed;
        }
        synchronized (lock) {
            entries.put(path, result);
            inFlight.remove(path);
        }
        future.complete(result);
        for (ThumbnailListener listener : listeners) {
            try {
                listener.onThumbnailReady(path, result);
            } catch (RuntimeException ex) {
                LOGGER.warn("Thumbnail listener {} failed", listener, ex);
            }
        }
    }
}
