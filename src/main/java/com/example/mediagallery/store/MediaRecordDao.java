package com.example.mediagallery.store;

import com.example.mediagallery.metadata.MediaRecord;
import org.jdbi.v3.sqlobject.config.RegisterRowMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;

@RegisterRowMapper(MediaRecordMapper.class)
public interface MediaRecordDao {

    @SqlUpdate("""
        CREATE TABLE IF NOT EXISTS media_files (
            id            INTEGER PRIMARY KEY AUTOINCREMENT,
            file_path     TEXT    NOT NULL UNIQUE,
            filename      TEXT    NOT NULL,
            extension     TEXT    NOT NULL,
            file_type     TEXT    NOT NULL,
            mime_type     TEXT,
            file_size     INTEGER NOT NULL DEFAULT 0,
            date_modified INTEGER,
            discovered_at INTEGER NOT NULL
        )
        """)
    void createTable();

    @SqlUpdate("CREATE INDEX IF NOT EXISTS idx_media_files_discovered ON media_files(discovered_at, id)")
    void createDiscoveredIndex();

    // OR IGNORE keeps the first row for a path; existing rows are never updated.
    @SqlUpdate("""
        INSERT OR IGNORE INTO media_files
            (file_path, filename, extension, file_type, mime_type, file_size, date_modified, discovered_at)
        VALUES
            (:path, :filename, :extension, :fileType, :mimeType, :sizeBytes, :lastModified, :discoveredAt)
        """)
    int insertIfAbsent(@Bind("path") String path,
                       @Bind("filename") String filename,
                       @Bind("extension") String extension,
                       @Bind("fileType") String fileType,
                       @Bind("mimeType") String mimeType,
                       @Bind("sizeBytes") long sizeBytes,
                       @Bind("lastModified") Long lastModified,
                       @Bind("discoveredAt") long discoveredAt);

    @SqlQuery("SELECT * FROM media_files ORDER BY discovered_at, id")
    List<MediaRecord> fetchAll();

    @SqlQuery("SELECT * FROM media_files WHERE file_path = :path")
    Optional<MediaRecord> fetchByPath(@Bind("path") String path);

    @SqlQuery("SELECT COUNT(*) FROM media_files WHERE file_path = :path")
    int countByPath(@Bind("path") String path);

    @SqlQuery("SELECT COUNT(*) FROM media_files")
    long countAll();

    @SqlQuery("SELECT COUNT(*) FROM media_files WHERE file_type = :fileType")
    long countByType(@Bind("fileType") String fileType);

    // substr keeps the match exact; LIKE would be case-insensitive and treat '_' as a wildcard.
    @SqlQuery("""
        SELECT *
          FROM media_files
         WHERE substr(file_path, 1, length(:prefix)) = :prefix
         ORDER BY discovered_at, id
        """)
    List<MediaRecord> fetchUnder(@Bind("prefix") String prefix);

    @SqlQuery("SELECT file_path FROM media_files")
    List<String> fetchAllPaths();

    @SqlUpdate("DELETE FROM media_files WHERE substr(file_path, 1, length(:prefix)) = :prefix")
    int deleteUnder(@Bind("prefix") String prefix);
}
