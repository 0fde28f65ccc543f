package com.example.fileingest.index;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A file found during a crawl, already hashed and classified.
 *
 * @param destinationDirectory classified directory the file belongs in if it becomes primary
 */
public record ObservedFile(
        String digest,
        Path source,
        long size,
        Instant modifiedTime,
        String customerRoot,
        String subfolder,
        Path destinationDirectory
) {
}
