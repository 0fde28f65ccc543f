package com.example.fileingest.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps uploaded objects in memory.
 */
public final class InMemoryObjectStorage implements ObjectStorage {
    private final Map<String, StoredObject> objects = new ConcurrentHashMap<>();

    @Override
    public boolean exists(String key) {
        return objects.containsKey(key);
    }

    @Override
    public Optional<Map<String, String>> metadata(String key) {
        return Optional.ofNullable(objects.get(key)).map(StoredObject::metadata);
    }

    @Override
    public void upload(String key, Path file, Map<String, String> metadata) throws IOException {
        objects.put(key, new StoredObject(Files.readAllBytes(file), Map.copyOf(metadata)));
    }

    @Override
    public boolean delete(String key) {
        return objects.remove(key) != null;
    }

    public int size() {
        return objects.size();
    }

    public record StoredObject(byte[] content, Map<String, String> metadata) {
    }
}
