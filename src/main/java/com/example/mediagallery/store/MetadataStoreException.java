package com.example.mediagallery.store;

/**
 * Raised when the backing database cannot be opened or a statement fails.
 */
public class MetadataStoreException extends RuntimeException {
    public MetadataStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
