package com.example.fileingest.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Persisted digest to {@link ContentRecord} map. Lookups are served from memory; every upsert is
 * written through to disk before it returns.
 */
public final class HashIndex implements Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(HashIndex.class);

    private final JsonLogStore<ContentRecord> store;

    public HashIndex(Path file) throws IOException {
        this.store = new JsonLogStore<>(file, JsonLogStore.defaultMapper(), ContentRecord.class);
    }

    public Optional<ContentRecord> get(String digest) {
        return store.get(digest);
    }

    public void put(ContentRecord record) throws IOException {
        store.put(record.digest(), record);
    }

    public List<ContentRecord> all() {
        return store.values();
    }

    public int size() {
        return store.size();
    }

    /**
     * Discards the in-memory cache and reloads it from disk. Called at the start of every crawl.
     */
    public void reload() throws IOException {
        store.reload();
        LOGGER.info("Loaded {} content records from {}", store.size(), store.path());
    }

    @Override
    public void close() throws IOException {
        store.close();
    }
}
