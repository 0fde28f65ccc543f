package com.example.fileingest;

/**
 * Raised when an operation cannot run in the current state, e.g. starting a crawl twice.
 * No state is mutated when this is thrown.
 */
public class ConflictException extends IngestException {
    public ConflictException(String message) {
        super(message);
    }
}
