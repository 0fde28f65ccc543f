package com.example.fileingest.review;

import com.example.fileingest.index.JsonLogStore;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Persisted queue of {@link ReviewItem}s keyed by item id.
 */
public final class ReviewStore implements Closeable {
    private final JsonLogStore<ReviewItem> store;

    public ReviewStore(Path file) throws IOException {
        this.store = new JsonLogStore<>(file, JsonLogStore.defaultMapper(), ReviewItem.class);
    }

    public void add(ReviewItem item) throws IOException {
        store.put(item.id(), item);
    }

    public Optional<ReviewItem> get(String id) {
        return store.get(id);
    }

    /**
     * Matching items, most recently modified first.
     */
    public List<ReviewItem> listPending(ReviewFilter filter) {
        return store.values().stream()
                .filter(filter::matches)
                .sorted(Comparator.comparing(ReviewItem::modifiedTime).reversed())
                .toList();
    }

    public boolean delete(String id) throws IOException {
        return store.remove(id);
    }

    /**
     * Normalized source paths of all pending items; the crawler leaves these files alone.
     */
    public Set<Path> pendingPaths() {
        return store.values().stream()
                .map(item -> Path.of(item.originalPath()).toAbsolutePath().normalize())
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public void close() throws IOException {
        store.close();
    }
}
