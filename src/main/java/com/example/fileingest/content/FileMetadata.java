package com.example.fileingest.content;

import java.time.Instant;

/**
 * Attributes of a single file as seen just before it is processed.
 */
public record FileMetadata(
        String path,
        String name,
        long size,
        String mimeType,
        String hashSha256,
        Instant createdTime,
        Instant lastModifiedTime
) {
    public boolean isText() {
        return mimeType != null && mimeType.startsWith("text/");
    }
}
