package com.example.fileingest.pipeline;

import java.util.List;

/**
 * Answer of a {@link Classifier}. {@code customer} and {@code project} are null when the content
 * names neither.
 */
public record ClassificationResult(
        String category,
        double confidence,
        String customer,
        String project,
        List<String> tags,
        String source
) {
    public ClassificationResult {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public boolean usable() {
        return category != null && !category.isBlank();
    }
}
