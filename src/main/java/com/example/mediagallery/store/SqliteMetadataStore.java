package com.example.mediagallery.store;

import com.example.mediagallery.metadata.FileType;
import com.example.mediagallery.metadata.MediaRecord;
import com.example.mediagallery.metadata.StoreStats;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * SQLite-backed {@link MetadataStore}. Each insert commits on its own, so a record that
 * {@link #upsert(MediaRecord)} reported is on disk before the call returns.
 */
public final class SqliteMetadataStore implements MetadataStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(SqliteMetadataStore.class);
    private static final int MAX_POOL_SIZE = 4;

    private final Path databaseFile;
    private final HikariDataSource dataSource;
    private final MediaRecordDao dao;
    private final Jdbi jdbi;

    private SqliteMetadataStore(Path databaseFile, HikariDataSource dataSource) {
        this.databaseFile = databaseFile;
        this.dataSource = dataSource;
        this.jdbi = Jdbi.create(dataSource);
        this.jdbi.installPlugin(new SqlObjectPlugin());
        this.dao = jdbi.onDemand(MediaRecordDao.class);
    }

    /**
     * Opens the database file, creating it and its schema on first use.
     *
     * @throws MetadataStoreException if the file cannot be created or opened
     */
    public static SqliteMetadataStore open(Path databaseFile) {
        Path file = databaseFile.toAbsolutePath().normalize();
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException ex) {
            throw new MetadataStoreException("Cannot create directory for " + file, ex);
        }

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:sqlite:" + file);
        config.setPoolName("media-store");
        config.setMaximumPoolSize(MAX_POOL_SIZE);
        config.setConnectionTestQuery("SELECT 1");
        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("synchronous", "FULL");
        config.addDataSourceProperty("busy_timeout", "10000");

        HikariDataSource dataSource;
        try {
            dataSource = new HikariDataSource(config);
        } catch (RuntimeException ex) {
            throw new MetadataStoreException("Cannot open media database " + file, ex);
        }

        SqliteMetadataStore store = new SqliteMetadataStore(file, dataSource);
        try {
            store.dao.createTable();
            store.dao.createDiscoveredIndex();
        } catch (JdbiException ex) {
            dataSource.close();
            throw new MetadataStoreException("Cannot initialise schema in " + file, ex);
        }
        LOGGER.info("Opened media database {}", file);
        return store;
    }

    @Override
    public boolean upsert(MediaRecord record) {
        try {
            int inserted = dao.insertIfAbsent(
                    record.path(),
                    record.filename(),
                    record.extension(),
                    record.fileType().storageName(),
                    record.mimeType(),
                    record.sizeBytes(),
                    toMillis(record.lastModified()),
                    record.discoveredAt().toEpochMilli()
            );
            return inserted > 0;
        } catch (JdbiException ex) {
            throw new MetadataStoreException("Failed to store " + record.path(), ex);
        }
    }

    @Override
    public List<MediaRecord> loadAll() {
        try {
            return dao.fetchAll();
        } catch (JdbiException ex) {
            throw new MetadataStoreException("Failed to load media records", ex);
        }
    }

    @Override
    public Optional<MediaRecord> get(String path) {
        try {
            return dao.fetchByPath(path);
        } catch (JdbiException ex) {
            throw new MetadataStoreException("Failed to look up " + path, ex);
        }
    }

    @Override
    public boolean exists(String path) {
        try {
            return dao.countByPath(path) > 0;
        } catch (JdbiException ex) {
            throw new MetadataStoreException("Failed to look up " + path, ex);
        }
    }

    @Override
    public long count() {
        try {
            return dao.countAll();
        } catch (JdbiException ex) {
            throw new MetadataStoreException("Failed to count media records", ex);
        }
    }

    @Override
    public List<MediaRecord> loadUnder(String folder) {
        try {
            return dao.fetchUnder(folderPrefix(folder));
        } catch (JdbiException ex) {
            throw new MetadataStoreException("Failed to load records under " + folder, ex);
        }
    }

    @Override
    public List<String> folders() {
        List<String> paths;
        try {
            paths = dao.fetchAllPaths();
        } catch (JdbiException ex) {
            throw new MetadataStoreException("Failed to list folders", ex);
        }
        TreeSet<String> folders = new TreeSet<>();
        for (String path : paths) {
            Path parent = Path.of(path).getParent();
            if (parent != null) {
                folders.add(parent.toString());
            }
        }
        return List.copyOf(folders);
    }

    @Override
    public int removeUnder(String folder) {
        try {
            int removed = dao.deleteUnder(folderPrefix(folder));
            LOGGER.info("Removed {} records under {}", removed, folder);
            return removed;
        } catch (JdbiException ex) {
            throw new MetadataStoreException("Failed to remove records under " + folder, ex);
        }
    }

    @Override
    public StoreStats stats() {
        try {
            return new StoreStats(
                    dao.countAll(),
                    dao.countByType(FileType.IMAGE.storageName()),
                    dao.countByType(FileType.VIDEO.storageName()),
                    dao.countByType(FileType.UNKNOWN.storageName()),
                    databaseBytes()
            );
        } catch (JdbiException ex) {
            throw new MetadataStoreException("Failed to compute statistics", ex);
        }
    }

    @Override
    public void compact() {
        try {
            jdbi.useHandle(handle -> handle.execute("VACUUM"));
            LOGGER.info("Compacted media database {}", databaseFile);
        } catch (JdbiException ex) {
            throw new MetadataStoreException("Failed to compact " + databaseFile, ex);
        }
    }

    @Override
    public void close() {
        dataSource.close();
    }

    public Path databaseFile() {
        return databaseFile;
    }

    private long databaseBytes() {
        long total = 0L;
        for (String suffix : List.of("", "-wal")) {
            Path file = databaseFile.resolveSibling(databaseFile.getFileName() + suffix);
            try {
                if (Files.exists(file)) {
                    total += Files.size(file);
                }
            } catch (IOException ex) {
                LOGGER.warn("Failed to read size of {}", file, ex);
            }
        }
        return total;
    }

    // Records carry real paths; a folder that no longer exists can only be matched as written.
    private static String folderPrefix(String folder) {
        Path path = Path.of(folder).toAbsolutePath().normalize();
        try {
            path = path.toRealPath();
        } catch (IOException ex) {
            LOGGER.debug("Matching {} as written: {}", folder, ex.toString());
        }
        String normalized = path.toString();
        return normalized.endsWith(File.separator) ? normalized : normalized + File.separator;
    }

    private static Long toMillis(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }
}
