package com.example.fileingest.document;

import com.example.fileingest.NotFoundException;
import com.example.fileingest.content.FileMover;
import com.example.fileingest.snapshot.RollbackOperation;
import com.example.fileingest.snapshot.SnapshotManager;
import com.example.fileingest.snapshot.SnapshotSubject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Edits to documents that are already placed. Each edit is preceded by a snapshot of the kind that
 * rolls it back.
 */
public final class DocumentService {
    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentService.class);

    private final DocumentStore documents;
    private final SnapshotManager snapshots;
    private final FileMover mover;
    private final Clock clock;
    private final boolean snapshotsEnabled;

    public DocumentService(DocumentStore documents,
                           SnapshotManager snapshots,
                           FileMover mover,
                           Clock clock,
                           boolean snapshotsEnabled) {
        this.documents = documents;
        this.snapshots = snapshots;
        this.mover = mover;
        this.clock = clock;
        this.snapshotsEnabled = snapshotsEnabled;
    }

    public DocumentRecord get(String id) {
        return documents.get(id).orElseThrow(() -> new NotFoundException("Document not found: " + id));
    }

    /**
     * Replaces the tags and metadata of a document.
     */
    public DocumentChange updateMetadata(String id, List<String> tags, Map<String, String> metadata) throws IOException {
        DocumentRecord current = get(id);
        String snapshotId = snapshot(RollbackOperation.METADATA_UPDATE, inPlace(current),
                "Update metadata of " + current.filename());
        DocumentRecord updated = current.withAnnotations(tags, metadata, clock.instant());
        documents.put(updated);
        LOGGER.info("Updated metadata of document {}", id);
        return new DocumentChange(updated, snapshotId);
    }

    public DocumentChange reclassify(String id, DocumentClassification classification) throws IOException {
        DocumentRecord current = get(id);
        String snapshotId = snapshot(RollbackOperation.CLASSIFICATION, inPlace(current),
                "Reclassify " + current.filename() + " as " + classification.category());
        DocumentRecord updated = current.withClassification(classification, DocumentStatus.RECLASSIFIED, clock.instant());
        documents.put(updated);
        LOGGER.info("Reclassified document {} as {}", id, classification.category());
        return new DocumentChange(updated, snapshotId);
    }

    /**
     * Moves the document file into {@code targetDirectory}, keeping its name unless taken.
     *
     * @throws NotFoundException if the document or its file does not exist
     */
    public DocumentChange relocate(String id, Path targetDirectory) throws IOException {
        DocumentRecord current = get(id);
        Path source = current.location();
        if (!Files.isRegularFile(source)) {
            throw new NotFoundException("File of document " + id + " not found: " + source);
        }
        Path target = mover.uniqueTarget(targetDirectory, source.getFileName().toString());
        String snapshotId = snapshot(RollbackOperation.STORAGE_MOVE,
                new SnapshotSubject(id, source, target, current.storageKey()),
                "Move " + current.filename() + " to " + targetDirectory);
        Path moved = mover.move(source, target);
        DocumentRecord updated = current.withLocation(moved, DocumentStatus.RELOCATED, clock.instant());
        documents.put(updated);
        LOGGER.info("Relocated document {} from {} to {}", id, source, moved);
        return new DocumentChange(updated, snapshotId);
    }

    private static SnapshotSubject inPlace(DocumentRecord record) {
        return SnapshotSubject.inPlace(record.id(), record.location(), record.storageKey());
    }

    private String snapshot(RollbackOperation operation, SnapshotSubject subject, String description) throws IOException {
        if (!snapshotsEnabled) {
            return null;
        }
        return snapshots.create(operation, List.of(subject), description).id();
    }
}
