package com.example.fileingest.crawler;

import com.example.fileingest.index.Resolution;

import java.nio.file.Path;

/**
 * Callback invoked on the crawl thread after each file has been fully resolved.
 */
@FunctionalInterface
public interface CrawlListener {
    void fileResolved(Path source, Resolution resolution);

    CrawlListener NONE = (source, resolution) -> {
    };
}
