package com.example.fileingest;

/**
 * Base type for failures that are reported to callers of the ingest components.
 */
public class IngestException extends RuntimeException {
    public IngestException(String message) {
        super(message);
    }

    public IngestException(String message, Throwable cause) {
        super(message, cause);
    }
}
