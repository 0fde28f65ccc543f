package com.example.fileingest.snapshot;

import com.example.fileingest.document.DocumentClassification;
import com.example.fileingest.document.DocumentRecord;
import com.example.fileingest.document.DocumentStatus;

import java.util.List;
import java.util.Map;

/**
 * Persisted fields of one document as they were before an operation. {@code exists} is false when
 * the operation was about to create the record.
 */
public record DocumentState(
        boolean exists,
        DocumentStatus status,
        DocumentClassification classification,
        List<String> tags,
        Map<String, String> metadata
) {
    public static DocumentState absent() {
        return new DocumentState(false, null, null, List.of(), Map.of());
    }

    public static DocumentState of(DocumentRecord record) {
        return new DocumentState(true, record.status(), record.classification(), record.tags(), record.metadata());
    }
}
