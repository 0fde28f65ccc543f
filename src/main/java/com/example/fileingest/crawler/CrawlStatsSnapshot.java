package com.example.fileingest.crawler;

import java.util.Map;

/**
 * Immutable copy of the running crawl counters.
 */
public record CrawlStatsSnapshot(
        long processed,
        long moved,
        long duplicates,
        long errors,
        Map<String, CustomerStats> byCustomer
) {
    public record CustomerStats(
            long processed,
            long duplicates,
            Map<String, SubfolderStats> bySubfolder
    ) {
    }

    public record SubfolderStats(
            long processed,
            long duplicates
    ) {
    }

    public static CrawlStatsSnapshot empty() {
        return new CrawlStatsSnapshot(0, 0, 0, 0, Map.of());
    }
}
