package com.example.AusFin.model;

/**
 * Read-only knowledge passage. The embedding stays inside the index.
 */
public record Passage(
        String id,
        String text,
        SourceMetadata metadata
) {
    public Passage {
        metadata = metadata == null ? new SourceMetadata(null, null, null, null) : metadata;
    }
}
