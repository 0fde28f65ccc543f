package com.example.fileingest.pipeline;

import com.example.fileingest.content.FileMetadata;

import java.nio.file.Path;

/**
 * A file that passed the duplicate and confidence checks and has a reserved destination.
 */
record ProcessingPlan(Path source, FileMetadata file, ClassificationResult classification, Path target) {

    String documentId() {
        return file.hashSha256();
    }
}
