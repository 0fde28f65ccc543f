package com.example.fileingest.document;

public enum BatchStatus {
    RUNNING,
    COMPLETED,
    COMPLETED_WITH_ERRORS
}
