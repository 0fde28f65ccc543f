package com.example.fileingest.snapshot;

import com.example.fileingest.document.BatchRecord;
import com.example.fileingest.document.BatchStatus;
import com.example.fileingest.document.BatchStore;
import com.example.fileingest.document.DocumentClassification;
import com.example.fileingest.document.DocumentRecord;
import com.example.fileingest.document.DocumentStatus;
import com.example.fileingest.document.DocumentStore;
import com.example.fileingest.storage.InMemoryObjectStorage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SnapshotManagerTest {
    private static final Instant T0 = Instant.parse("2024-03-01T08:30:00Z");

    private Path root;
    private DocumentStore documents;
    private BatchStore batches;
    private InMemoryObjectStorage storage;
    private SnapshotRepository repository;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("snapshots");
        documents = new DocumentStore(root.resolve("documents.log"));
        batches = new BatchStore(root.resolve("batches.log"));
        storage = new InMemoryObjectStorage();
        repository = new SnapshotRepository(root.resolve("snapshots"));
    }

    @AfterEach
    void tearDown() throws Exception {
        documents.close();
        batches.close();
    }

    @Test
    void capturesDocumentStorageAndPathState() throws Exception {
        DocumentRecord existing = record("doc-1", root.resolve("sorted/a.pdf"));
        documents.put(existing);
        Path upload = Files.writeString(root.resolve("upload.bin"), "bytes");
        storage.upload("doc-1/a.pdf", upload, Map.of("category", "finanzen"));

        Snapshot snapshot = managerAt(T0).create(RollbackOperation.STORAGE_MOVE, List.of(
                new SnapshotSubject("doc-1", root.resolve("sorted/a.pdf"), root.resolve("archive/a.pdf"), "doc-1/a.pdf"),
                new SnapshotSubject("doc-2", root.resolve("in/b.pdf"), root.resolve("sorted/b.pdf"), "doc-2/b.pdf")
        ), "move");

        assertTrue(snapshot.id().matches("snapshot_20240301_083000_storage_move_[0-9a-f]{8}"), snapshot.id());
        assertEquals(List.of("doc-1", "doc-2"), snapshot.fileIds());
        assertEquals(root.resolve("archive/a.pdf").toString(), snapshot.targetPaths().get("doc-1"));
        assertEquals(DocumentState.of(existing), snapshot.databaseState().get("doc-1"));
        assertFalse(snapshot.databaseState().get("doc-2").exists());
        assertTrue(snapshot.storageState().get("doc-1").exists());
        assertEquals(Map.of("category", "finanzen"), snapshot.storageState().get("doc-1").metadata());
        assertFalse(snapshot.storageState().get("doc-2").exists());

        Snapshot loaded = managerAt(T0).get(snapshot.id()).orElseThrow();
        assertEquals(snapshot, loaded);
    }

    @Test
    void batchSnapshotsCaptureBatchRecord() throws Exception {
        BatchRecord batch = new BatchRecord("batch-1", BatchStatus.RUNNING, 3, 0, 0, T0, null);
        batches.put(batch);

        Snapshot snapshot = managerAt(T0).create(RollbackOperation.BATCH_PROCESSING,
                List.of(SnapshotSubject.inPlace("doc-1", root.resolve("a"), null)), "batch-1", "batch", Map.of());

        assertEquals("batch-1", snapshot.batchId());
        assertEquals(batch, snapshot.batchState());
    }

    @Test
    void refusesEmptySnapshotsAndOverwrites() throws Exception {
        SnapshotManager manager = managerAt(T0);
        assertThrows(IllegalArgumentException.class,
                () -> manager.create(RollbackOperation.METADATA_UPDATE, List.of(), "nothing"));

        Snapshot snapshot = manager.create(RollbackOperation.METADATA_UPDATE,
                List.of(SnapshotSubject.inPlace("doc-1", root.resolve("a"), null)), "meta");
        assertThrows(FileAlreadyExistsException.class, () -> repository.save(snapshot));
    }

    @Test
    void listsNewestFirstWithFilters() throws Exception {
        Snapshot first = create(T0, RollbackOperation.CLASSIFICATION);
        Snapshot second = create(T0.plusSeconds(60), RollbackOperation.METADATA_UPDATE);
        Snapshot third = create(T0.plusSeconds(120), RollbackOperation.CLASSIFICATION);
        SnapshotManager manager = managerAt(T0.plusSeconds(180));

        assertEquals(List.of(third.id(), second.id(), first.id()), ids(manager.list(null, null, 10)));
        assertEquals(List.of(third.id(), first.id()), ids(manager.list(RollbackOperation.CLASSIFICATION, null, 10)));
        assertEquals(List.of(third.id(), second.id()), ids(manager.list(null, T0.plusSeconds(60), 10)));
        assertEquals(List.of(third.id()), ids(manager.list(null, null, 1)));
    }

    @Test
    void cleanupRemovesSnapshotsPastRetention() throws Exception {
        Snapshot old = create(T0, RollbackOperation.CLASSIFICATION);
        Snapshot recent = create(T0.plus(Duration.ofDays(20)), RollbackOperation.CLASSIFICATION);

        int removed = managerAt(T0.plus(Duration.ofDays(31))).cleanupOldSnapshots();

        assertEquals(1, removed);
        assertTrue(repository.load(old.id()).isEmpty());
        assertTrue(repository.load(recent.id()).isPresent());
    }

    @Test
    void unknownOrMalformedIdsAreAbsent() throws Exception {
        assertTrue(managerAt(T0).get("snapshot_missing").isEmpty());
        assertTrue(managerAt(T0).get("../documents").isEmpty());
    }

    private Snapshot create(Instant at, RollbackOperation operation) throws Exception {
        return managerAt(at).create(operation, List.of(SnapshotSubject.inPlace("doc", root.resolve("x"), null)), "test");
    }

    private SnapshotManager managerAt(Instant instant) {
        return new SnapshotManager(repository, documents, batches, storage, Clock.fixed(instant, ZoneOffset.UTC), 30);
    }

    private static List<String> ids(List<Snapshot> snapshots) {
        return snapshots.stream().map(Snapshot::id).toList();
    }

    static DocumentRecord record(String id, Path location) {
        return new DocumentRecord(id, location.getFileName().toString(), location.toString(), location.toString(),
                5, "application/pdf", DocumentStatus.PROCESSED,
                new DocumentClassification("finanzen", 0.9, "1234_Acme", null),
                List.of("rechnung"), Map.of("source_path", location.toString(), "note", "ä ß ✓"),
                null, null, T0, T0);
    }
}
