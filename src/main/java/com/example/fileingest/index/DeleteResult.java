package com.example.fileingest.index;

import java.util.List;
import java.util.Map;

/**
 * Per-path outcome of a bulk delete; {@code failed} maps each path that was kept to the reason.
 */
public record DeleteResult(List<String> deleted, Map<String, String> failed) {
    public DeleteResult {
        deleted = List.copyOf(deleted);
        failed = Map.copyOf(failed);
    }
}
