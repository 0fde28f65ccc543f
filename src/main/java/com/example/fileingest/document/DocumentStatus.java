package com.example.fileingest.document;

public enum DocumentStatus {
    PROCESSED,
    RECLASSIFIED,
    RELOCATED
}
