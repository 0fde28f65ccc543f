package com.example.fileingest.pipeline;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic rule table over document content. Rules are tried in order and the first rule with
 * a matching keyword decides the category.
 */
public final class KeywordClassifier implements Classifier {
    public static final String SOURCE = "keywords";
    public static final String UNSORTED = "unsorted";

    private static final Pattern CUSTOMER_CODE = Pattern.compile("\\b(\\d{4,6}_[\\w\\-]+)", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern PROJECT = Pattern.compile("(?i)\\b(?:projekt|project)\\s*[:#]\\s*([\\w\\-]+)",
            Pattern.UNICODE_CHARACTER_CLASS);

    private static final List<Rule> RULES = List.of(
            new Rule("finanzen", 0.7, "rechnung", List.of("rechnung", "invoice", "bill", "zahlung", "payment")),
            new Rule("finanzen", 0.7, "vertrag", List.of("vertrag", "contract", "agreement", "vereinbarung")),
            new Rule("projekte", 0.6, "projekt", List.of("projekt", "project", "website", "webdesign")),
            new Rule("personal", 0.6, "personal", List.of("personal", "bewerbung", "application")),
            new Rule("footage", 0.6, "media", List.of("video", "footage", "foto", "photo", "bild"))
    );

    @Override
    public ClassificationResult classify(String content) {
        String text = content == null ? "" : content;
        String lower = text.toLowerCase(Locale.ROOT);
        String customer = firstGroup(CUSTOMER_CODE, text);
        String project = firstGroup(PROJECT, text);
        for (Rule rule : RULES) {
            for (String keyword : rule.keywords()) {
                if (lower.contains(keyword)) {
                    return new ClassificationResult(rule.category(), rule.confidence(), customer, project,
                            List.of(rule.tag()), SOURCE);
                }
            }
        }
        return new ClassificationResult(UNSORTED, 0.0, customer, project, List.of(UNSORTED), SOURCE);
    }

    private static String firstGroup(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }

    private record Rule(String category, double confidence, String tag, List<String> keywords) {
    }
}
