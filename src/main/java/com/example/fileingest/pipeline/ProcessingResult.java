package com.example.fileingest.pipeline;

/**
 * Outcome for one input file. Fields that do not apply to the status are null: {@code duplicateOf}
 * is set only for duplicates, {@code reviewId} only for files queued for review.
 */
public record ProcessingResult(
        ProcessingStatus status,
        String sourcePath,
        String documentId,
        String targetPath,
        String duplicateOf,
        String reviewId,
        String snapshotId,
        ClassificationResult classification,
        String message
) {
    static ProcessingResult failed(String sourcePath, String documentId, String snapshotId, String message) {
        return new ProcessingResult(ProcessingStatus.FAILED, sourcePath, documentId, null, null, null,
                snapshotId, null, message);
    }
}
