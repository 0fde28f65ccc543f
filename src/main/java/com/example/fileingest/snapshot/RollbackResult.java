package com.example.fileingest.snapshot;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of replaying one snapshot. {@code success} is true only when every file was restored.
 */
public record RollbackResult(
        String snapshotId,
        RollbackOperation operationType,
        boolean success,
        String message,
        int filesRestored,
        int filesFailed,
        List<String> errors,
        Duration duration
) {
    public RollbackResult {
        errors = List.copyOf(errors);
    }
}
