package com.example.mediagallery;

import com.example.mediagallery.metadata.ScanProgress;
import com.example.mediagallery.metadata.ScanResult;
import com.example.mediagallery.metadata.ScanStatus;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle on one scan. Readable from any thread; mutated only by the scan thread and by cancellation.
 */
public final class ScanSession {
    private volatile Path root;
    private final Instant requestedAt;
    private final AtomicReference<ScanStatus> status = new AtomicReference<>(ScanStatus.IDLE);
    private final AtomicLong attempted = new AtomicLong();
    private final AtomicLong inserted = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final CountDownLatch done = new CountDownLatch(1);
    private volatile boolean cancelRequested;
    private volatile Path currentTarget;
    private volatile ScanResult result;

    ScanSession(Path root, Instant requestedAt) {
        this.root = root;
        this.requestedAt = requestedAt;
    }

    /**
     * The root as requested until the scan thread opens it, its real path afterwards.
     */
    public Path root() {
        return root;
    }

    public ScanStatus status() {
        return status.get();
    }

    /**
     * Path of the file most recently handed to the store, or null before the first one.
     */
    public Path currentTarget() {
        return currentTarget;
    }

    public long attempted() {
        return attempted.get();
    }

    public long inserted() {
        return inserted.get();
    }

    public long skipped() {
        return skipped.get();
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public Optional<ScanResult> result() {
        return Optional.ofNullable(result);
    }

    /**
     * Waits until the session reached a terminal status and every listener saw the result.
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return done.await(timeout, unit);
    }

    ScanProgress progress() {
        return new ScanProgress(root, currentTarget, attempted.get(), inserted.get(), skipped.get());
    }

    void resolveRoot(Path realRoot) {
        root = realRoot;
    }

    boolean markRunning() {
        return !cancelRequested && status.compareAndSet(ScanStatus.IDLE, ScanStatus.RUNNING);
    }

    boolean requestCancel() {
        if (status.get().isTerminal()) {
            return false;
        }
        cancelRequested = true;
        status.compareAndSet(ScanStatus.RUNNING, ScanStatus.CANCELLING);
        return true;
    }

    void beginFile(Path path) {
        currentTarget = path;
    }

    void recordAttempt(boolean newRecord) {
        attempted.incrementAndGet();
        if (newRecord) {
            inserted.incrementAndGet();
        }
    }

    void recordSkip() {
        attempted.incrementAndGet();
        skipped.incrementAndGet();
    }

    ScanResult finish(ScanStatus terminal, String failureReason, int walkFailures, Instant finishedAt) {
        status.set(terminal);
        result = new ScanResult(
                root,
                terminal,
                attempted.get(),
                inserted.get(),
                skipped.get(),
                walkFailures,
                failureReason,
                requestedAt,
                finishedAt
        );
        return result;
    }

    void signalDone() {
        done.countDown();
    }
}
