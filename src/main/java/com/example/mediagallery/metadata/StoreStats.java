package com.example.mediagallery.metadata;

public record StoreStats(
        long totalRecords,
        long images,
        long videos,
        long unknown,
        long databaseBytes
) {
}
