package com.example.fileingest.review;

import java.time.Instant;

public record FeedbackRecord(
        String id,
        String chosenCategory,
        String suggestedCategory,
        double confidence,
        String customer,
        String project,
        String filename,
        String movedTo,
        Instant confirmedAt
) {
}
