package com.example.mediagallery;

import com.example.mediagallery.metadata.FileType;
import com.example.mediagallery.metadata.ImageDetails;
import com.example.mediagallery.metadata.LastScanInfo;
import com.example.mediagallery.metadata.MediaExtensions;
import com.example.mediagallery.metadata.MediaRecord;
import com.example.mediagallery.metadata.ScanProgress;
import com.example.mediagallery.metadata.ScanResult;
import com.example.mediagallery.metadata.ScanStatus;
import com.example.mediagallery.metadata.StoreStats;
import com.example.mediagallery.store.MetadataStore;
import com.example.mediagallery.store.SqliteMetadataStore;
import com.example.mediagallery.thumbnail.ImageIoThumbnailDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    private static final long SHUTDOWN_WAIT_SECONDS = 30L;
    private static final String USAGE = "Usage: java -jar media-gallery.jar <config.json> "
            + "<scan <root> | list [folder] | info <file> | folders | forget <folder> | stats | compact | last-scan"
            + " | add-extension <image|video> <ext> | remove-extension <image|video> <ext>>";

    private App() {
    }

    public static void main(String[] args) throws Exception {
        // A config path and a command are always required; the config file itself may not exist yet.
        if (args.length < 2) {
            LOGGER.error(USAGE);
            System.exit(1);
        }
        Path configPath = Path.of(args[0]);
        ConfigLoader loader = new ConfigLoader();
        GalleryConfig config = loader.load(configPath);
        String command = args[1];
        List<String> rest = Arrays.asList(args).subList(2, args.length);

        int status = switch (command) {
            case "scan" -> rest.size() == 1 ? scan(config, Path.of(rest.get(0))) : usage();
            case "list" -> rest.size() <= 1 ? list(config, rest.isEmpty() ? null : rest.get(0)) : usage();
            case "info" -> rest.size() == 1 ? info(config, Path.of(rest.get(0))) : usage();
            case "folders" -> folders(config);
            case "forget" -> rest.size() == 1 ? forget(config, rest.get(0)) : usage();
            case "stats" -> stats(config);
            case "compact" -> compact(config);
            case "last-scan" -> lastScan(config);
            case "add-extension", "remove-extension" -> rest.size() == 2
                    ? editExtensions(loader, config, configPath, command.startsWith("add"), rest.get(0), rest.get(1))
                    : usage();
            default -> usage();
        };
        System.exit(status);
    }

    private static int scan(GalleryConfig config, Path root) throws InterruptedException {
        try (MetadataStore store = SqliteMetadataStore.open(config.databasePath());
             ScanCoordinator coordinator = new ScanCoordinator(store, config)) {
            coordinator.subscribe(new ScanListener() {
                @Override
                public void onProgress(ScanProgress progress) {
                    LOGGER.info("[{} files, {} new] {}", progress.attempted(), progress.inserted(), progress.currentPath());
                }
            });
            // Ctrl-C stops after the file being stored. The hook stays registered; once the scan is over
            // it finds no active session and returns at once.
            Runtime.getRuntime().addShutdownHook(new Thread(() -> stopOnShutdown(coordinator), "media-scan-cancel"));

            ScanSession session = coordinator.startScan(root);
            while (!session.awaitTermination(1, TimeUnit.SECONDS)) {
                LOGGER.debug("Still scanning {}", session.currentTarget());
            }

            ScanResult result = session.result().orElseThrow();
            if (result.status() == ScanStatus.FAILED) {
                LOGGER.error("Scan failed: {}", result.failureReason());
                return 2;
            }
            LOGGER.info("Scan {}. Found {} new files.", result.status().name().toLowerCase(Locale.ROOT), result.inserted());
            return result.status() == ScanStatus.COMPLETED ? 0 : 3;
        }
    }

    private static void stopOnShutdown(ScanCoordinator coordinator) {
        try {
            if (!coordinator.cancelAndAwait(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                LOGGER.warn("Scan did not stop within {} seconds", SHUTDOWN_WAIT_SECONDS);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for the scan to stop.", ex);
        }
    }

    private static int list(GalleryConfig config, String folder) {
        try (MetadataStore store = SqliteMetadataStore.open(config.databasePath())) {
            List<MediaRecord> records = folder == null ? store.loadAll() : store.loadUnder(folder);
            for (MediaRecord record : records) {
                System.out.printf("%-7s %10d  %s%n", record.fileType().storageName(), record.sizeBytes(), record.path());
            }
            return 0;
        }
    }

    private static int info(GalleryConfig config, Path file) {
        Path target = file.toAbsolutePath().normalize();
        try {
            target = target.toRealPath();
        } catch (IOException ex) {
            LOGGER.warn("Failed to resolve {}", target, ex);
        }
        Optional<MediaRecord> found;
        try (MetadataStore store = SqliteMetadataStore.open(config.databasePath())) {
            found = store.get(target.toString());
        }
        if (found.isEmpty()) {
            System.out.printf("%s is not indexed%n", target);
            return 0;
        }
        MediaRecord record = found.get();
        System.out.printf("path:      %s%n", record.path());
        System.out.printf("type:      %s (%s)%n", record.fileType().storageName(), record.mimeType());
        System.out.printf("size:      %d bytes%n", record.sizeBytes());
        System.out.printf("modified:  %s%n", record.lastModified());
        System.out.printf("indexed:   %s%n", record.discoveredAt());
        if (record.fileType() == FileType.IMAGE) {
            try {
                ImageDetails details = new ImageIoThumbnailDecoder().details(target);
                System.out.printf("format:    %s%n", details.formatName());
                System.out.printf("pixels:    %d x %d px (aspect %.2f)%n",
                        details.width(), details.height(), details.aspectRatio());
            } catch (IOException ex) {
                LOGGER.warn("Failed to read image header of {}", target, ex);
            }
        }
        return 0;
    }

    private static int folders(GalleryConfig config) {
        try (MetadataStore store = SqliteMetadataStore.open(config.databasePath())) {
            store.folders().forEach(System.out::println);
            return 0;
        }
    }

    private static int forget(GalleryConfig config, String folder) {
        try (MetadataStore store = SqliteMetadataStore.open(config.databasePath())) {
            int removed = store.removeUnder(folder);
            System.out.printf("Removed %d records under %s%n", removed, folder);
            return 0;
        }
    }

    private static int stats(GalleryConfig config) {
        try (MetadataStore store = SqliteMetadataStore.open(config.databasePath())) {
            StoreStats stats = store.stats();
            System.out.printf("records: %d (images %d, videos %d, other %d)%n",
                    stats.totalRecords(), stats.images(), stats.videos(), stats.unknown());
            System.out.printf("database: %d bytes%n", stats.databaseBytes());
            return 0;
        }
    }

    private static int compact(GalleryConfig config) {
        try (MetadataStore store = SqliteMetadataStore.open(config.databasePath())) {
            long before = store.stats().databaseBytes();
            store.compact();
            System.out.printf("database: %d -> %d bytes%n", before, store.stats().databaseBytes());
            return 0;
        }
    }

    private static int lastScan(GalleryConfig config) throws IOException {
        Optional<LastScanInfo> info = new LastScanStore(config.lastScanFile()).load();
        if (info.isEmpty()) {
            System.out.println("No scan recorded.");
            return 0;
        }
        LastScanInfo last = info.get();
        System.out.printf("%s %s %s: %d new of %d scanned%n",
                last.timestamp(), last.root(), last.status(), last.newFilesCount(), last.totalFilesScanned());
        return 0;
    }

    private static int editExtensions(ConfigLoader loader,
                                      GalleryConfig config,
                                      Path configPath,
                                      boolean add,
                                      String typeName,
                                      String extension) throws IOException {
        FileType type = FileType.fromStorageName(typeName);
        if (type == FileType.UNKNOWN) {
            return usage();
        }
        MediaExtensions current = config.extensions();
        MediaExtensions updated = add
                ? current.withExtension(type, extension)
                : current.withoutExtension(type, extension);
        if (updated.equals(current)) {
            LOGGER.info("Extension set for {} unchanged.", type.storageName());
            return 0;
        }
        loader.save(config.withExtensions(updated), configPath);
        LOGGER.info("{} {} {} in {}", add ? "Added" : "Removed", MediaExtensions.normalize(extension), type.storageName(), configPath);
        return 0;
    }

    private static int usage() {
        LOGGER.error(USAGE);
        return 1;
    }
}
