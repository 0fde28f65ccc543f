package com.example.fileingest.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Kind of mutation a snapshot guards. Each kind has its own rollback handler.
 */
public enum RollbackOperation {
    @JsonProperty("file_processing")
    FILE_PROCESSING,
    @JsonProperty("batch_processing")
    BATCH_PROCESSING,
    @JsonProperty("metadata_update")
    METADATA_UPDATE,
    @JsonProperty("classification")
    CLASSIFICATION,
    @JsonProperty("storage_move")
    STORAGE_MOVE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
