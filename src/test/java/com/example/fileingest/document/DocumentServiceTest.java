package com.example.fileingest.document;

import com.example.fileingest.NotFoundException;
import com.example.fileingest.content.FileMover;
import com.example.fileingest.snapshot.RollbackOperation;
import com.example.fileingest.snapshot.Snapshot;
import com.example.fileingest.snapshot.SnapshotManager;
import com.example.fileingest.snapshot.SnapshotRepository;
import com.example.fileingest.storage.ObjectStorage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DocumentServiceTest {
    private static final Instant CREATED = Instant.parse("2024-01-01T08:00:00Z");
    private static final Instant NOW = Instant.parse("2024-03-02T09:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private Path root;
    private DocumentStore documents;
    private BatchStore batches;
    private SnapshotManager snapshots;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("documents");
        documents = new DocumentStore(root.resolve("state/documents.log"));
        batches = new BatchStore(root.resolve("state/batches.log"));
        snapshots = new SnapshotManager(new SnapshotRepository(root.resolve("state/snapshots")), documents, batches,
                ObjectStorage.none(), clock, 30);
    }

    @AfterEach
    void tearDown() throws Exception {
        documents.close();
        batches.close();
    }

    @Test
    void unknownDocumentIsNotFound() {
        DocumentService service = service(true);

        assertThrows(NotFoundException.class, () -> service.get("missing"));
        assertThrows(NotFoundException.class, () -> service.updateMetadata("missing", List.of(), Map.of()));
    }

    @Test
    void metadataUpdateReplacesAnnotationsAfterSnapshot() throws Exception {
        Path file = Files.writeString(root.resolve("offer.pdf"), "pdf");
        documents.put(document("d1", file));

        DocumentChange change = service(true).updateMetadata("d1", List.of("signed"), Map.of("reviewer", "kim"));

        assertEquals(List.of("signed"), change.document().tags());
        assertEquals(Map.of("reviewer", "kim"), change.document().metadata());
        assertEquals(NOW, change.document().updatedAt());
        assertEquals(DocumentStatus.PROCESSED, change.document().status());
        Snapshot snapshot = snapshots.get(change.snapshotId()).orElseThrow();
        assertEquals(RollbackOperation.METADATA_UPDATE, snapshot.operationType());
        assertEquals(List.of("draft"), snapshot.databaseState().get("d1").tags());
        assertEquals(change.document(), documents.get("d1").orElseThrow());
    }

    @Test
    void reclassifyMarksDocument() throws Exception {
        Path file = Files.writeString(root.resolve("offer.pdf"), "pdf");
        documents.put(document("d1", file));
        DocumentClassification manual = new DocumentClassification("projekte", 1.0, "1234_Acme", "Relaunch");

        DocumentChange change = service(true).reclassify("d1", manual);

        assertEquals(manual, change.document().classification());
        assertEquals(DocumentStatus.RECLASSIFIED, change.document().status());
        assertEquals(RollbackOperation.CLASSIFICATION, snapshots.get(change.snapshotId()).orElseThrow().operationType());
    }

    @Test
    void relocateKeepsExistingFilesAtTheTarget() throws Exception {
        Path file = Files.writeString(root.resolve("offer.pdf"), "pdf");
        Path target = Files.createDirectories(root.resolve("elsewhere"));
        Files.writeString(target.resolve("offer.pdf"), "other");
        documents.put(document("d1", file));

        DocumentChange change = service(true).relocate("d1", target);

        Path moved = target.resolve("offer_1.pdf");
        assertEquals(moved.toString(), change.document().currentPath());
        assertEquals(DocumentStatus.RELOCATED, change.document().status());
        assertTrue(Files.exists(moved));
        assertFalse(Files.exists(file));
        assertEquals("other", Files.readString(target.resolve("offer.pdf")));
        Snapshot snapshot = snapshots.get(change.snapshotId()).orElseThrow();
        assertEquals(moved.toString(), snapshot.targetPaths().get("d1"));
    }

    @Test
    void relocateOfMissingFileIsNotFound() throws Exception {
        documents.put(document("d1", root.resolve("vanished.pdf")));

        assertThrows(NotFoundException.class, () -> service(true).relocate("d1", root.resolve("elsewhere")));
        assertTrue(snapshots.list(null, null, 10).isEmpty());
    }

    @Test
    void editsWithoutSnapshotsHaveNoSnapshotId() throws Exception {
        Path file = Files.writeString(root.resolve("offer.pdf"), "pdf");
        documents.put(document("d1", file));

        DocumentChange change = service(false).updateMetadata("d1", List.of(), Map.of());

        assertNull(change.snapshotId());
        assertTrue(snapshots.list(null, null, 10).isEmpty());
    }

    private DocumentService service(boolean snapshotsEnabled) {
        return new DocumentService(documents, snapshots, new FileMover(), clock, snapshotsEnabled);
    }

    private static DocumentRecord document(String id, Path location) {
        return new DocumentRecord(id, location.getFileName().toString(), location.toString(), location.toString(),
                3, "application/pdf", DocumentStatus.PROCESSED,
                new DocumentClassification("finanzen", 0.8, "1234_Acme", null),
                List.of("draft"), Map.of("source_path", location.toString()),
                null, null, CREATED, CREATED);
    }
}
