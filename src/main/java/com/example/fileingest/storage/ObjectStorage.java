package com.example.fileingest.storage;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Remote copy of placed documents. Keys are logical ({@code <document id>/<file name>}); an
 * implementation may add its own prefix.
 */
public interface ObjectStorage {

    boolean exists(String key) throws IOException;

    /**
     * User metadata of the stored object, or empty if there is no such object.
     */
    Optional<Map<String, String>> metadata(String key) throws IOException;

    void upload(String key, Path file, Map<String, String> metadata) throws IOException;

    /**
     * @return false if there was nothing to delete
     */
    boolean delete(String key) throws IOException;

    default boolean enabled() {
        return true;
    }

    static String keyFor(String documentId, String fileName) {
        return documentId + "/" + fileName;
    }

    /**
     * Storage that holds nothing and accepts nothing; used when no bucket is configured.
     */
    static ObjectStorage none() {
        return NoObjectStorage.INSTANCE;
    }
}
