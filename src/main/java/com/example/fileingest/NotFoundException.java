package com.example.fileingest;

public class NotFoundException extends IngestException {
    public NotFoundException(String message) {
        super(message);
    }
}
