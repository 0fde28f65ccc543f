package com.example.fileingest.index;

import java.time.Instant;

/**
 * A file found in a customer's quarantine folder.
 */
public record QuarantinedFile(
        String path,
        String customerRoot,
        String name,
        long size,
        Instant modifiedTime
) {
}
