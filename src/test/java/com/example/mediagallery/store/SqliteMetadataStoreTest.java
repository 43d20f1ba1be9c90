package com.example.mediagallery.store;

import com.example.mediagallery.metadata.FileType;
import com.example.mediagallery.metadata.MediaRecord;
import com.example.mediagallery.metadata.StoreStats;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqliteMetadataStoreTest {
    @TempDir
    Path dir;

    private SqliteMetadataStore store;

    @BeforeEach
    void open() {
        store = SqliteMetadataStore.open(dir.resolve("nested/dirs/media.db"));
    }

    @AfterEach
    void close() {
        store.close();
    }

    @Test
    void firstOpenCreatesDatabaseFile() {
        assertTrue(Files.exists(dir.resolve("nested/dirs/media.db")));
        assertEquals(0L, store.count());
        assertTrue(store.loadAll().isEmpty());
    }

    @Test
    void repeatedPathsKeepTheFirstRecord() {
        MediaRecord first = record("/media/a.jpg", FileType.IMAGE, 1_000L);
        MediaRecord again = new MediaRecord("/media/a.jpg", "a.jpg", "jpg", FileType.VIDEO, "video/mp4",
                999L, null, Instant.ofEpochMilli(5_000L));

        assertTrue(store.upsert(first));
        assertFalse(store.upsert(again));
        assertFalse(store.upsert(first));

        assertEquals(1L, store.count());
        assertEquals(first, store.get("/media/a.jpg").orElseThrow());
    }

    @Test
    void loadsInDiscoveryOrderAndLooksUpByPath() {
        store.upsert(record("/media/c.mp4", FileType.VIDEO, 3_000L));
        store.upsert(record("/media/a.jpg", FileType.IMAGE, 1_000L));
        store.upsert(record("/media/b.txt", FileType.UNKNOWN, 2_000L));

        List<String> paths = store.loadAll().stream().map(MediaRecord::path).toList();

        assertEquals(List.of("/media/a.jpg", "/media/b.txt", "/media/c.mp4"), paths);
        assertTrue(store.exists("/media/b.txt"));
        assertFalse(store.exists("/media/missing.jpg"));
        assertTrue(store.get("/media/missing.jpg").isEmpty());
    }

    @Test
    void recordsSurviveReopening() {
        MediaRecord record = record("/media/keep.png", FileType.IMAGE, 1_000L);
        store.upsert(record);
        store.close();

        store = SqliteMetadataStore.open(dir.resolve("nested/dirs/media.db"));

        assertEquals(List.of(record), store.loadAll());
    }

    @Test
    void folderQueriesMatchWholeDirectoryNames() {
        store.upsert(record("/photos/a.jpg", FileType.IMAGE, 1L));
        store.upsert(record("/photos/2020/b.jpg", FileType.IMAGE, 2L));
        store.upsert(record("/photos_backup/c.jpg", FileType.IMAGE, 3L));
        store.upsert(record("/Photos/d.jpg", FileType.IMAGE, 4L));

        List<String> under = store.loadUnder("/photos").stream().map(MediaRecord::path).toList();

        assertEquals(List.of("/photos/a.jpg", "/photos/2020/b.jpg"), under);
        assertEquals(List.of("/Photos", "/photos", "/photos/2020", "/photos_backup"), store.folders());
    }

    @Test
    void removesEverythingBelowAFolder() {
        store.upsert(record("/photos/a.jpg", FileType.IMAGE, 1L));
        store.upsert(record("/photos/2020/b.jpg", FileType.IMAGE, 2L));
        store.upsert(record("/photos_backup/c.jpg", FileType.IMAGE, 3L));

        assertEquals(2, store.removeUnder("/photos/"));
        assertEquals(List.of("/photos_backup/c.jpg"), store.loadAll().stream().map(MediaRecord::path).toList());
        assertEquals(0, store.removeUnder("/nowhere"));
    }

    @Test
    void reportsStatisticsAndCompacts() {
        store.upsert(record("/m/a.jpg", FileType.IMAGE, 1L));
        store.upsert(record("/m/b.png", FileType.IMAGE, 2L));
        store.upsert(record("/m/c.mkv", FileType.VIDEO, 3L));
        store.upsert(record("/m/d.txt", FileType.UNKNOWN, 4L));

        StoreStats stats = store.stats();
        assertEquals(new StoreStats(4L, 2L, 1L, 1L, stats.databaseBytes()), stats);
        assertTrue(stats.databaseBytes() > 0L);

        store.removeUnder("/m");
        store.compact();
        assertEquals(0L, store.stats().totalRecords());
    }

    @Test
    void concurrentUpsertsOfOnePathStoreOneRow() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                long discovered = i;
                Callable<Boolean> task = () -> {
                    start.await();
                    return store.upsert(record("/media/shared.jpg", FileType.IMAGE, discovered));
                };
                results.add(pool.submit(task));
            }
            start.countDown();
            int inserted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(30, TimeUnit.SECONDS)) {
                    inserted++;
                }
            }
            assertEquals(1, inserted);
            assertEquals(1L, store.count());
        } finally {
            pool.shutdownNow();
        }
    }

    private static MediaRecord record(String path, FileType type, long discoveredMillis) {
        String filename = Path.of(path).getFileName().toString();
        return new MediaRecord(
                path,
                filename,
                MediaRecord.extensionOf(filename),
                type,
                "application/octet-stream",
                42L,
                Instant.ofEpochMilli(discoveredMillis / 2),
                Instant.ofEpochMilli(discoveredMillis)
        );
    }
}
