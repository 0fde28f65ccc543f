package com.example.fileingest.review;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A low-confidence classification waiting for an operator to confirm the category.
 */
public record ReviewItem(
        String id,
        String originalPath,
        String filename,
        long size,
        Instant modifiedTime,
        String suggestedCategory,
        double confidence,
        String customer,
        String project,
        List<String> tags,
        Map<String, String> metadata
) {
    public ReviewItem {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        tags = tags == null ? List.of() : List.copyOf(tags);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
