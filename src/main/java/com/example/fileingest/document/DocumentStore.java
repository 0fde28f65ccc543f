package com.example.fileingest.document;

import com.example.fileingest.index.JsonLogStore;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Persisted document records keyed by content digest. Doubles as the duplicate check of the
 * processing pipeline.
 */
public final class DocumentStore implements Closeable {
    private final JsonLogStore<DocumentRecord> store;

    public DocumentStore(Path file) throws IOException {
        this.store = new JsonLogStore<>(file, JsonLogStore.defaultMapper(), DocumentRecord.class);
    }

    public Optional<DocumentRecord> get(String id) {
        return store.get(id);
    }

    public void put(DocumentRecord record) throws IOException {
        store.put(record.id(), record);
    }

    public boolean delete(String id) throws IOException {
        return store.remove(id);
    }

    public List<DocumentRecord> findByBatch(String batchId) {
        return store.values().stream()
                .filter(record -> batchId.equals(record.batchId()))
                .toList();
    }

    public List<DocumentRecord> all() {
        return store.values();
    }

    @Override
    public void close() throws IOException {
        store.close();
    }
}
