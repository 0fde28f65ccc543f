package com.example.fileingest.index;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Current primary location of one distinct content digest.
 */
public record ContentRecord(
        String digest,
        String path,
        long size,
        Instant modifiedTime,
        String customerRoot
) {
    public Path location() {
        return Path.of(path);
    }

    public ContentRecord withModifiedTime(Instant time) {
        return new ContentRecord(digest, path, size, time, customerRoot);
    }
}
