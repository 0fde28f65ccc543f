package com.example.fileingest.document;

/**
 * Classification fields persisted with a document. {@code customer} and {@code project} may be null.
 */
public record DocumentClassification(String category, double confidence, String customer, String project) {
}
