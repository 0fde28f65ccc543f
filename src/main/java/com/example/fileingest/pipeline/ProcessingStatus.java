package com.example.fileingest.pipeline;

public enum ProcessingStatus {
    PROCESSED,
    DUPLICATE,
    REVIEW,
    FAILED
}
