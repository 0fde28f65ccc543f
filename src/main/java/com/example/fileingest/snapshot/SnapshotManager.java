package com.example.fileingest.snapshot;

import com.example.fileingest.document.BatchRecord;
import com.example.fileingest.document.BatchStore;
import com.example.fileingest.document.DocumentStore;
import com.example.fileingest.storage.ObjectStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Captures the state of the files an operation is about to touch and keeps it for a retention
 * window. A snapshot is on disk before {@link #create} returns, so callers mutate only afterwards.
 */
public final class SnapshotManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(SnapshotManager.class);
    private static final DateTimeFormatter ID_TIME = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss")
            .withZone(ZoneOffset.UTC);

    private final SnapshotRepository repository;
    private final DocumentStore documents;
    private final BatchStore batches;
    private final ObjectStorage storage;
    private final Clock clock;
    private final Duration retention;

    public SnapshotManager(SnapshotRepository repository,
                           DocumentStore documents,
                           BatchStore batches,
                           ObjectStorage storage,
                           Clock clock,
                           int retentionDays) {
        if (retentionDays < 0) {
            throw new IllegalArgumentException("retentionDays must not be negative");
        }
        this.repository = repository;
        this.documents = documents;
        this.batches = batches;
        this.storage = storage;
        this.clock = clock;
        this.retention = Duration.ofDays(retentionDays);
    }

    public Snapshot create(RollbackOperation operation, List<SnapshotSubject> subjects, String description)
            throws IOException {
        return create(operation, subjects, null, description, Map.of());
    }

    /**
     * Records the current database, storage and path state of every subject.
     *
     * @param batchId owning batch; its record is captured as well. May be null.
     */
    public Snapshot create(RollbackOperation operation,
                           List<SnapshotSubject> subjects,
                           String batchId,
                           String description,
                           Map<String, String> metadata) throws IOException {
        if (subjects.isEmpty()) {
            throw new IllegalArgumentException("A snapshot needs at least one file");
        }
        Instant now = clock.instant();
        List<String> fileIds = new ArrayList<>();
        Map<String, String> originalPaths = new LinkedHashMap<>();
        Map<String, String> targetPaths = new LinkedHashMap<>();
        Map<String, DocumentState> databaseState = new LinkedHashMap<>();
        Map<String, StorageState> storageState = new LinkedHashMap<>();
        for (SnapshotSubject subject : subjects) {
            String fileId = subject.fileId();
            if (originalPaths.containsKey(fileId)) {
                throw new IllegalArgumentException("Duplicate file id in snapshot: " + fileId);
            }
            fileIds.add(fileId);
            originalPaths.put(fileId, subject.originalPath().toString());
            targetPaths.put(fileId, subject.targetPath().toString());
            databaseState.put(fileId, documents.get(fileId).map(DocumentState::of).orElseGet(DocumentState::absent));
            storageState.put(fileId, captureStorage(subject.storageKey()));
        }
        BatchRecord batchState = batchId == null ? null : batches.get(batchId).orElse(null);

        Snapshot snapshot = new Snapshot(
                newId(operation, now),
                operation,
                now,
                description,
                fileIds,
                batchId,
                originalPaths,
                targetPaths,
                databaseState,
                storageState,
                batchState,
                metadata
        );
        repository.save(snapshot);
        LOGGER.info("Created snapshot {} for {} covering {} file(s)", snapshot.id(), operation.label(), fileIds.size());
        return snapshot;
    }

    public Optional<Snapshot> get(String id) throws IOException {
        return repository.load(id);
    }

    /**
     * Snapshots newest first.
     *
     * @param operation only this kind, or all when null
     * @param since     only snapshots taken at or after this instant, or all when null
     */
    public List<Snapshot> list(RollbackOperation operation, Instant since, int limit) throws IOException {
        return repository.loadAll().stream()
                .filter(snapshot -> operation == null || snapshot.operationType() == operation)
                .filter(snapshot -> since == null || !snapshot.timestamp().isBefore(since))
                .sorted(Comparator.comparing(Snapshot::timestamp).reversed().thenComparing(Snapshot::id))
                .limit(Math.max(0, limit))
                .toList();
    }

    /**
     * Deletes snapshots older than the retention window.
     *
     * @return number of snapshots deleted
     */
    public int cleanupOldSnapshots() throws IOException {
        Instant cutoff = clock.instant().minus(retention);
        int deleted = 0;
        for (Snapshot snapshot : repository.loadAll()) {
            if (snapshot.timestamp().isBefore(cutoff) && repository.delete(snapshot.id())) {
                deleted++;
            }
        }
        LOGGER.info("Removed {} snapshot(s) older than {}", deleted, cutoff);
        return deleted;
    }

    private StorageState captureStorage(String key) throws IOException {
        if (key == null || !storage.enabled()) {
            return new StorageState(key, false, Map.of());
        }
        Optional<Map<String, String>> metadata = storage.metadata(key);
        return new StorageState(key, metadata.isPresent(), metadata.orElse(Map.of()));
    }

    private String newId(RollbackOperation operation, Instant now) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return "snapshot_" + ID_TIME.format(now) + "_" + operation.label() + "_" + suffix;
    }
}
