package com.example.fileingest.document;

import java.time.Instant;

/**
 * Aggregate progress of one batch run. {@code completedAt} is null while the batch is running.
 */
public record BatchRecord(
        String id,
        BatchStatus status,
        int totalFiles,
        int processedFiles,
        int failedFiles,
        Instant startedAt,
        Instant completedAt
) {
    public BatchRecord withCounters(int processed, int failed) {
        return new BatchRecord(id, status, totalFiles, processed, failed, startedAt, completedAt);
    }

    public BatchRecord complete(Instant time) {
        BatchStatus finalStatus = failedFiles > 0 ? BatchStatus.COMPLETED_WITH_ERRORS : BatchStatus.COMPLETED;
        return new BatchRecord(id, finalStatus, totalFiles, processedFiles, failedFiles, startedAt, time);
    }
}
