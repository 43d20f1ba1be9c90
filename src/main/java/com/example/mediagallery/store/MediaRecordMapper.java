package com.example.mediagallery.store;

import com.example.mediagallery.metadata.FileType;
import com.example.mediagallery.metadata.MediaRecord;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

public class MediaRecordMapper implements RowMapper<MediaRecord> {

    @Override
    public MediaRecord map(ResultSet rs, StatementContext ctx) throws SQLException {
        long modifiedMillis = rs.getLong("date_modified");
        Instant lastModified = rs.wasNull() ? null : Instant.ofEpochMilli(modifiedMillis);
        return new MediaRecord(
                rs.getString("file_path"),
                rs.getString("filename"),
                rs.getString("extension"),
                FileType.fromStorageName(rs.getString("file_type")),
                rs.getString("mime_type"),
                rs.getLong("file_size"),
                lastModified,
                Instant.ofEpochMilli(rs.getLong("discovered_at"))
        );
    }
}
