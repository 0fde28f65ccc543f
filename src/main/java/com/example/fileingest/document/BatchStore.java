package com.example.fileingest.document;

import com.example.fileingest.index.JsonLogStore;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

public final class BatchStore implements Closeable {
    private final JsonLogStore<BatchRecord> store;

    public BatchStore(Path file) throws IOException {
        this.store = new JsonLogStore<>(file, JsonLogStore.defaultMapper(), BatchRecord.class);
    }

    public Optional<BatchRecord> get(String id) {
        return store.get(id);
    }

    public void put(BatchRecord record) throws IOException {
        store.put(record.id(), record);
    }

    @Override
    public void close() throws IOException {
        store.close();
    }
}
