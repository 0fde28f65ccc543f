package com.example.fileingest.pipeline;

import java.io.IOException;

/**
 * Assigns a category to document content. Implementations backed by a remote model throw
 * {@link IOException} when the model cannot be reached.
 */
@FunctionalInterface
public interface Classifier {

    ClassificationResult classify(String content) throws IOException;
}
