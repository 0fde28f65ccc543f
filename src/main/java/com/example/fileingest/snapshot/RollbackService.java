package com.example.fileingest.snapshot;

import com.example.fileingest.NotFoundException;
import com.example.fileingest.content.FileMover;
import com.example.fileingest.document.BatchStore;
import com.example.fileingest.document.DocumentRecord;
import com.example.fileingest.document.DocumentStore;
import com.example.fileingest.storage.ObjectStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Undoes an operation by replaying the state captured in its snapshot.
 * <p>
 * Files are restored one at a time; a failure on one file is recorded in the result and the
 * remaining files are still restored.
 */
public final class RollbackService {
    private static final Logger LOGGER = LoggerFactory.getLogger(RollbackService.class);

    private final SnapshotManager snapshots;
    private final DocumentStore documents;
    private final BatchStore batches;
    private final ObjectStorage storage;
    private final FileMover mover;
    private final Clock clock;

    public RollbackService(SnapshotManager snapshots,
                           DocumentStore documents,
                           BatchStore batches,
                           ObjectStorage storage,
                           FileMover mover,
                           Clock clock) {
        this.snapshots = snapshots;
        this.documents = documents;
        this.batches = batches;
        this.storage = storage;
        this.mover = mover;
        this.clock = clock;
    }

    /**
     * @throws NotFoundException if no snapshot has this id
     */
    public RollbackResult rollback(String snapshotId) throws IOException {
        Snapshot snapshot = snapshots.get(snapshotId)
                .orElseThrow(() -> new NotFoundException("Snapshot not found: " + snapshotId));
        Instant started = clock.instant();
        LOGGER.info("Rolling back {} ({})", snapshot.id(), snapshot.operationType().label());

        FileHandler handler = switch (snapshot.operationType()) {
            case FILE_PROCESSING, BATCH_PROCESSING -> this::restoreProcessing;
            case METADATA_UPDATE -> this::restoreMetadata;
            case CLASSIFICATION -> this::restoreClassification;
            case STORAGE_MOVE -> this::restoreLocation;
        };

        List<String> errors = new ArrayList<>();
        int restored = 0;
        for (String fileId : snapshot.fileIds()) {
            try {
                handler.restore(snapshot, fileId);
                restored++;
            } catch (IOException | RuntimeException ex) {
                LOGGER.warn("Failed to restore {} from snapshot {}", fileId, snapshot.id(), ex);
                errors.add(fileId + ": " + ex.getMessage());
            }
        }
        if (snapshot.operationType() == RollbackOperation.BATCH_PROCESSING) {
            restoreBatch(snapshot, errors);
        }

        int failed = snapshot.fileIds().size() - restored;
        boolean success = errors.isEmpty();
        String message = success
                ? "Restored " + restored + " file(s)"
                : "Restored " + restored + " file(s), " + errors.size() + " error(s)";
        Duration duration = Duration.between(started, clock.instant());
        LOGGER.info("Rollback of {} finished: {}", snapshot.id(), message);
        return new RollbackResult(snapshot.id(), snapshot.operationType(), success, message,
                restored, failed, errors, duration);
    }

    private void restoreProcessing(Snapshot snapshot, String fileId) throws IOException {
        Path original = restoreFile(snapshot, fileId);
        DocumentState state = snapshot.databaseState().get(fileId);
        if (state == null || !state.exists()) {
            documents.delete(fileId);
        } else {
            DocumentRecord current = requireDocument(fileId);
            documents.put(new DocumentRecord(
                    current.id(),
                    current.filename(),
                    current.originalPath(),
                    original.toString(),
                    current.size(),
                    current.mimeType(),
                    state.status(),
                    state.classification(),
                    state.tags(),
                    state.metadata(),
                    current.batchId(),
                    current.storageKey(),
                    current.createdAt(),
                    clock.instant()
            ));
        }
        StorageState storageState = snapshot.storageState().get(fileId);
        if (storageState != null && storageState.key() != null && !storageState.exists()
                && storage.exists(storageState.key())) {
            storage.delete(storageState.key());
        }
    }

    private void restoreMetadata(Snapshot snapshot, String fileId) throws IOException {
        DocumentState state = requireState(snapshot, fileId);
        DocumentRecord current = requireDocument(fileId);
        documents.put(current.withAnnotations(state.tags(), state.metadata(), clock.instant()));
    }

    private void restoreClassification(Snapshot snapshot, String fileId) throws IOException {
        DocumentState state = requireState(snapshot, fileId);
        DocumentRecord current = requireDocument(fileId);
        documents.put(current.withClassification(state.classification(), state.status(), clock.instant()));
    }

    private void restoreLocation(Snapshot snapshot, String fileId) throws IOException {
        DocumentState state = requireState(snapshot, fileId);
        DocumentRecord current = requireDocument(fileId);
        Path original = restoreFile(snapshot, fileId);
        documents.put(current.withLocation(original, state.status(), clock.instant()));
    }

    /**
     * Moves the file from its target path back to its original path when the two differ.
     *
     * @return the original path
     */
    private Path restoreFile(Snapshot snapshot, String fileId) throws IOException {
        String originalValue = snapshot.originalPaths().get(fileId);
        String targetValue = snapshot.targetPaths().get(fileId);
        if (originalValue == null || targetValue == null) {
            throw new IllegalStateException("Snapshot has no paths for " + fileId);
        }
        Path original = Path.of(originalValue);
        Path target = Path.of(targetValue);
        if (original.equals(target)) {
            return original;
        }
        if (Files.exists(target)) {
            if (Files.exists(original)) {
                throw new FileAlreadyExistsException(original.toString());
            }
            mover.move(target, original);
            LOGGER.debug("Moved {} back to {}", target, original);
        } else if (!Files.exists(original)) {
            throw new NoSuchFileException(target.toString());
        }
        return original;
    }

    private void restoreBatch(Snapshot snapshot, List<String> errors) {
        if (snapshot.batchState() == null) {
            return;
        }
        try {
            batches.put(snapshot.batchState());
        } catch (IOException ex) {
            LOGGER.warn("Failed to restore batch {} from snapshot {}", snapshot.batchId(), snapshot.id(), ex);
            errors.add("batch " + snapshot.batchId() + ": " + ex.getMessage());
        }
    }

    private DocumentState requireState(Snapshot snapshot, String fileId) {
        DocumentState state = snapshot.databaseState().get(fileId);
        if (state == null || !state.exists()) {
            throw new IllegalStateException("Snapshot holds no document state for " + fileId);
        }
        return state;
    }

    private DocumentRecord requireDocument(String fileId) {
        return documents.get(fileId)
                .orElseThrow(() -> new NotFoundException("Document record missing: " + fileId));
    }

    @FunctionalInterface
    private interface FileHandler {
        void restore(Snapshot snapshot, String fileId) throws IOException;
    }
}
