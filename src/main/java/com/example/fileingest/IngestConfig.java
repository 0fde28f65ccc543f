package com.example.fileingest;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable runtime settings for crawling, sorting and document processing.
 */
public record IngestConfig(
        List<Path> shares,
        List<String> internalRoots,
        Path centralBase,
        boolean enableYearSubfolders,
        List<String> yearFoldersUnder,
        Path indexStorePath,
        boolean followLinks,
        List<String> excludeFilePatterns,
        List<String> excludeDirectoryPatterns,
        double reviewConfidenceThreshold,
        int processingWorkers,
        boolean backupEnabled,
        Path backupDirectory,
        boolean snapshotsEnabled,
        Map<String, String> categoryPaths,
        int snapshotRetentionDays,
        Optional<String> s3Bucket,
        Optional<String> s3Prefix,
        Optional<String> s3Region
) {
    public Path hashIndexFile() {
        return indexStorePath.resolve("crawler_hash_index.log");
    }

    public Path reviewStoreFile() {
        return indexStorePath.resolve("review_store.log");
    }

    public Path feedbackLogFile() {
        return indexStorePath.resolve("classification_feedback.jsonl");
    }

    public Path documentStoreFile() {
        return indexStorePath.resolve("documents.log");
    }

    public Path batchStoreFile() {
        return indexStorePath.resolve("batches.log");
    }

    public Path snapshotDirectory() {
        return indexStorePath.resolve("snapshots");
    }

    public boolean objectStorageEnabled() {
        return s3Bucket.isPresent();
    }
}
