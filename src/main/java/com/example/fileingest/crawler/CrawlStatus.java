package com.example.fileingest.crawler;

import java.time.Instant;

public record CrawlStatus(
        CrawlerState state,
        boolean running,
        boolean stopRequested,
        Instant startedAt,
        Instant finishedAt,
        CrawlStatsSnapshot stats
) {
}
