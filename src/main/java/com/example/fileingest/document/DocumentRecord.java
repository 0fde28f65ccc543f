package com.example.fileingest.document;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A document placed by the processing pipeline, keyed by the SHA-256 digest of its content.
 */
public record DocumentRecord(
        String id,
        String filename,
        String originalPath,
        String currentPath,
        long size,
        String mimeType,
        DocumentStatus status,
        DocumentClassification classification,
        List<String> tags,
        Map<String, String> metadata,
        String batchId,
        String storageKey,
        Instant createdAt,
        Instant updatedAt
) {
    public DocumentRecord {
        tags = tags == null ? List.of() : List.copyOf(tags);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(metadata));
    }

    public Path location() {
        return Path.of(currentPath);
    }

    public DocumentRecord withLocation(Path path, DocumentStatus newStatus, Instant time) {
        return new DocumentRecord(id, filename, originalPath, path.toString(), size, mimeType, newStatus,
                classification, tags, metadata, batchId, storageKey, createdAt, time);
    }

    public DocumentRecord withClassification(DocumentClassification newClassification,
                                             DocumentStatus newStatus,
                                             Instant time) {
        return new DocumentRecord(id, filename, originalPath, currentPath, size, mimeType, newStatus,
                newClassification, tags, metadata, batchId, storageKey, createdAt, time);
    }

    public DocumentRecord withAnnotations(List<String> newTags, Map<String, String> newMetadata, Instant time) {
        return new DocumentRecord(id, filename, originalPath, currentPath, size, mimeType, status,
                classification, newTags, newMetadata, batchId, storageKey, createdAt, time);
    }
}
