package com.example.mediagallery;

import com.example.mediagallery.metadata.DiscoveredFile;
import com.example.mediagallery.metadata.LastScanInfo;
import com.example.mediagallery.metadata.MediaRecord;
import com.example.mediagallery.metadata.ScanProgress;
import com.example.mediagallery.metadata.ScanResult;
import com.example.mediagallery.metadata.ScanStatus;
import com.example.mediagallery.store.MetadataStore;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Runs one walk at a time on a dedicated thread, feeding every discovered file into the
 * {@link MetadataStore} and reporting progress to subscribed {@link ScanListener}s.
 *
 * <p>Files are ingested strictly in walk order and a file is reported only after its upsert attempt
 * finished. Cancellation is checked between files, never during an upsert.
 */
public final class ScanCoordinator implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScanCoordinator.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30L;

    private final MetadataStore store;
    private final MediaWalker walker;
    private final MediaRecordExtractor extractor;
    private final LastScanStore lastScanStore;
    private final long progressIntervalNanos;
    private final Clock clock;
    private final ExecutorService executor;
    private final List<ScanListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicReference<ScanSession> active = new AtomicReference<>();
    private volatile ScanResult lastResult;

    public ScanCoordinator(MetadataStore store, GalleryConfig config) {
        this(
                store,
                new MediaWalker(config),
                new MediaRecordExtractor(new Tika()),
                new LastScanStore(config.lastScanFile()),
                config.progressIntervalMillis(),
                Clock.systemUTC()
        );
    }

    ScanCoordinator(MetadataStore store,
                    MediaWalker walker,
                    MediaRecordExtractor extractor,
                    LastScanStore lastScanStore,
                    long progressIntervalMillis,
                    Clock clock) {
        this.store = store;
        this.walker = walker;
        this.extractor = extractor;
        this.lastScanStore = lastScanStore;
        this.progressIntervalNanos = TimeUnit.MILLISECONDS.toNanos(progressIntervalMillis);
        this.clock = clock;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "media-scan");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Registers a listener for all future sessions.
     */
    public Subscription subscribe(ScanListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Starts scanning {@code root} in the background and returns at once. A root that cannot be opened
     * ends the session in {@link ScanStatus#FAILED} without it ever becoming {@link ScanStatus#RUNNING}.
     *
     * @throws ScanAlreadyRunningException if another session has not finished yet
     */
    public ScanSession startScan(Path root) {
        ScanSession session = new ScanSession(root.toAbsolutePath().normalize(), clock.instant());
        ScanSession current = active.compareAndExchange(null, session);
        if (current != null) {
            throw new ScanAlreadyRunningException(current.root());
        }
        try {
            executor.execute(() -> run(session));
        } catch (RejectedExecutionException ex) {
            active.compareAndSet(session, null);
            throw new IllegalStateException("Scan coordinator is closed.", ex);
        }
        return session;
    }

    /**
     * Asks the active session to stop after the file currently being stored.
     *
     * @return true if there was a session to cancel
     */
    public boolean cancel() {
        ScanSession session = active.get();
        if (session == null || !session.requestCancel()) {
            return false;
        }
        LOGGER.info("Cancellation requested for scan of {}", session.root());
        return true;
    }

    /**
     * Cancels the active session, if any, and waits until it has stored its current file and
     * reported its result.
     *
     * @return false if the session was still running when the timeout elapsed
     */
    public boolean cancelAndAwait(long timeout, TimeUnit unit) throws InterruptedException {
        ScanSession session = active.get();
        if (session == null) {
            return true;
        }
        if (session.requestCancel()) {
            LOGGER.info("Cancellation requested for scan of {}", session.root());
        }
        return session.awaitTermination(timeout, unit);
    }

    /**
     * Status of the active session, or {@link ScanStatus#IDLE} when none is active.
     */
    public ScanStatus status() {
        ScanSession session = active.get();
        return session == null ? ScanStatus.IDLE : session.status();
    }

    public Optional<ScanSession> currentSession() {
        return Optional.ofNullable(active.get());
    }

    public Optional<ScanResult> lastResult() {
        return Optional.ofNullable(lastResult);
    }

    @Override
    public void close() {
        cancel();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOGGER.warn("Scan thread did not stop within {} seconds", SHUTDOWN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for the scan thread to stop.", ex);
            executor.shutdownNow();
        }
    }

    private void run(ScanSession session) {
        try {
            scan(session);
        } finally {
            // Reached without a result only when an Error escaped the scan.
            if (session.result().isEmpty()) {
                LOGGER.error("Scan of {} ended without a result", session.root());
                finish(session, ScanStatus.FAILED, "Scan thread terminated unexpectedly", 0);
            }
        }
    }

    private void scan(ScanSession session) {
        MediaWalk walk;
        try {
            walk = walker.walk(session.root());
        } catch (IOException ex) {
            LOGGER.error("Cannot scan {}", session.root(), ex);
            finish(session, ScanStatus.FAILED, describe(ex), 0);
            return;
        }
        session.resolveRoot(walk.root());
        if (!session.markRunning()) {
            finish(session, ScanStatus.CANCELLED, null, 0);
            return;
        }

        LOGGER.info("Scanning {}", session.root());
        notifyListeners(listener -> listener.onStarted(session));

        long lastEmit = 0L;
        boolean first = true;
        ScanProgress unsent = null;
        try {
            while (!session.isCancelRequested() && walk.hasNext()) {
                ingest(session, walk.next());
                ScanProgress progress = session.progress();
                long now = System.nanoTime();
                if (first || now - lastEmit >= progressIntervalNanos) {
                    emit(progress);
                    lastEmit = now;
                    first = false;
                    unsent = null;
                } else {
                    unsent = progress;
                }
            }
        } catch (RuntimeException ex) {
            LOGGER.error("Scan of {} aborted", session.root(), ex);
            flush(unsent);
            finish(session, ScanStatus.FAILED, describe(ex), walk.failures().size());
            return;
        }
        // The last attempted file is always reported before the session finishes.
        flush(unsent);
        ScanStatus terminal = session.isCancelRequested() ? ScanStatus.CANCELLED : ScanStatus.COMPLETED;
        finish(session, terminal, null, walk.failures().size());
    }

    private void ingest(ScanSession session, DiscoveredFile file) {
        session.beginFile(file.path());
        try {
            MediaRecord record = extractor.extract(file);
            boolean inserted = store.upsert(record);
            session.recordAttempt(inserted);
            LOGGER.debug("{} {}", inserted ? "Added" : "Already indexed", file.path());
        } catch (RuntimeException ex) {
            LOGGER.warn("Failed to store {}", file.path(), ex);
            session.recordSkip();
        }
    }

    private void emit(ScanProgress progress) {
        notifyListeners(listener -> listener.onProgress(progress));
    }

    private void flush(ScanProgress unsent) {
        if (unsent != null) {
            emit(unsent);
        }
    }

    private void finish(ScanSession session, ScanStatus terminal, String failureReason, int walkFailures) {
        ScanResult result = session.finish(terminal, failureReason, walkFailures, clock.instant());
        lastResult = result;
        try {
            LOGGER.info("Scan of {} finished as {}: {} files, {} new, {} skipped, {} unreadable entries",
                    session.root(), terminal, result.attempted(), result.inserted(), result.skipped(), walkFailures);
            saveLastScan(result);
        } finally {
            // Free the slot first so a listener may start the next scan from onFinished.
            active.compareAndSet(session, null);
        }
        try {
            notifyListeners(listener -> listener.onFinished(result));
        } finally {
            session.signalDone();
        }
    }

    private void saveLastScan(ScanResult result) {
        try {
            lastScanStore.save(LastScanInfo.from(result));
        } catch (IOException ex) {
            LOGGER.warn("Failed to save last scan summary to {}", lastScanStore.path(), ex);
        }
    }

    private void notifyListeners(Consumer<ScanListener> action) {
        for (ScanListener listener : listeners) {
            try {
                action.accept(listener);
            } catch (RuntimeException ex) {
                LOGGER.warn("Scan listener {} failed", listener, ex);
            }
        }
    }

    private static String describe(Exception ex) {
        String message = ex.getMessage();
        return ex.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }

    /**
     * Handle returned by {@link #subscribe(ScanListener)}; closing it removes the listener.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
