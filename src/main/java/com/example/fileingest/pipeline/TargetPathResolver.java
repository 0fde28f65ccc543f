package com.example.fileingest.pipeline;

import com.example.fileingest.content.PathClassifier;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Map;

/**
 * Renders the per-category directory template ({@code {customer}}, {@code {project}},
 * {@code {year}}) below the central base.
 */
public final class TargetPathResolver {
    static final String DEFAULT_TEMPLATE = "{customer}/" + PathClassifier.FALLBACK_SUBFOLDER;

    private final Path centralBase;
    private final Map<String, String> templates;
    private final ZoneId zone;

    public TargetPathResolver(Path centralBase, Map<String, String> templates, ZoneId zone) {
        this.centralBase = centralBase.toAbsolutePath().normalize();
        this.templates = Map.copyOf(templates);
        this.zone = zone;
    }

    public Path directoryFor(ClassificationResult classification, Instant modifiedTime) {
        String category = classification.category() == null
                ? KeywordClassifier.UNSORTED
                : classification.category().toLowerCase(Locale.ROOT);
        String template = templates.getOrDefault(category,
                templates.getOrDefault(KeywordClassifier.UNSORTED, DEFAULT_TEMPLATE));
        String rendered = template
                .replace("{customer}", segment(classification.customer(), PathClassifier.FALLBACK_CUSTOMER))
                .replace("{project}", segment(classification.project(), PathClassifier.FALLBACK_SUBFOLDER))
                .replace("{year}", String.valueOf(modifiedTime.atZone(zone).getYear()));
        Path directory = centralBase.resolve(rendered).normalize();
        if (!directory.startsWith(centralBase)) {
            throw new IllegalArgumentException("Template for " + category + " leaves the central base: " + template);
        }
        return directory;
    }

    private String segment(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String cleaned = value.trim().replace('/', '_').replace('\\', '_');
        if (cleaned.equals(".") || cleaned.equals("..")) {
            return fallback;
        }
        return cleaned;
    }
}
