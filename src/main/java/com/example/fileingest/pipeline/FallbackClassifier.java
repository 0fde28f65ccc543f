package com.example.fileingest.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Asks the model first and falls back to keyword rules when the model fails or gives no category.
 */
public final class FallbackClassifier implements Classifier {
    private static final Logger LOGGER = LoggerFactory.getLogger(FallbackClassifier.class);

    private final Classifier model;
    private final Classifier fallback;

    public FallbackClassifier(Classifier model, Classifier fallback) {
        this.model = model;
        this.fallback = fallback;
    }

    @Override
    public ClassificationResult classify(String content) throws IOException {
        try {
            ClassificationResult result = model.classify(content);
            if (result != null && result.usable()) {
                return result;
            }
            LOGGER.debug("Model returned no usable category; using keyword rules");
        } catch (IOException | RuntimeException ex) {
            LOGGER.warn("Classification model unavailable; using keyword rules", ex);
        }
        return fallback.classify(content);
    }
}
