package com.docingest.ingest;

import java.util.Locale;

public enum ContentType {
    TEXT("text"),
    PDF("pdf");

    private final String label;

    ContentType(String label) {
        this.label = label;
    }

    /**
     * Lower-case name written into chunk ids, vector metadata and the {@code content_type} column.
     */
    public String label() {
        return label;
    }

    public static ContentType fromLabel(String label) {
        for (ContentType type : values()) {
            if (type.label.equals(label.toLowerCase(Locale.ROOT))) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown content type: " + label);
    }
}
