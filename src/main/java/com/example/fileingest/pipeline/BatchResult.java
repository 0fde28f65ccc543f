package com.example.fileingest.pipeline;

import java.util.List;

/**
 * One result per input, in input order. {@code snapshotId} is null when nothing was moved or
 * snapshots are disabled.
 */
public record BatchResult(String batchId, String snapshotId, List<ProcessingResult> results) {
    public BatchResult {
        results = List.copyOf(results);
    }

    public long count(ProcessingStatus status) {
        return results.stream().filter(result -> result.status() == status).count();
    }

    public int total() {
        return results.size();
    }
}
