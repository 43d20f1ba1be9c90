package com.example.mediagallery.metadata;

import java.util.Locale;

/**
 * Classification assigned to a discovered file. Stored as its lower-case name.
 */
public enum FileType {
    IMAGE,
    VIDEO,
    UNKNOWN;

    public String storageName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static FileType fromStorageName(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (FileType type : values()) {
            if (type.storageName().equalsIgnoreCase(value)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
