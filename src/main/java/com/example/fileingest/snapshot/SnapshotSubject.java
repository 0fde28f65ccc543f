package com.example.fileingest.snapshot;

import java.nio.file.Path;

/**
 * One file an operation is about to touch: where it is now, where the operation will put it, and
 * its object storage key.
 */
public record SnapshotSubject(String fileId, Path originalPath, Path targetPath, String storageKey) {

    public static SnapshotSubject inPlace(String fileId, Path path, String storageKey) {
        return new SnapshotSubject(fileId, path, path, storageKey);
    }
}
