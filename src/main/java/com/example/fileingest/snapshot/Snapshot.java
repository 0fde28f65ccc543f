package com.example.fileingest.snapshot;

import com.example.fileingest.document.BatchRecord;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * State captured immediately before a mutating operation. Immutable once persisted.
 * {@code batchId} and {@code batchState} are null unless the operation belongs to a batch.
 */
public record Snapshot(
        String id,
        RollbackOperation operationType,
        Instant timestamp,
        String description,
        List<String> fileIds,
        String batchId,
        Map<String, String> originalPaths,
        Map<String, String> targetPaths,
        Map<String, DocumentState> databaseState,
        Map<String, StorageState> storageState,
        BatchRecord batchState,
        Map<String, String> metadata
) {
    public Snapshot {
        fileIds = List.copyOf(fileIds);
        originalPaths = Map.copyOf(originalPaths);
        targetPaths = Map.copyOf(targetPaths);
        databaseState = Map.copyOf(databaseState);
        storageState = Map.copyOf(storageState);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
