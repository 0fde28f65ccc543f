package com.example.fileingest.crawler;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters for one crawl run. Written by the crawl thread, readable from any thread.
 */
public final class CrawlStats {
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong moved = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final Map<String, Counter> byCustomer = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Counter>> bySubfolder = new ConcurrentHashMap<>();

    public void recordProcessed(String customerRoot, String subfolder) {
        processed.incrementAndGet();
        customer(customerRoot).processed.incrementAndGet();
        subfolder(customerRoot, subfolder).processed.incrementAndGet();
    }

    public void recordMoved() {
        moved.incrementAndGet();
    }

    public void recordDuplicate(String customerRoot, String subfolder) {
        duplicates.incrementAndGet();
        customer(customerRoot).duplicates.incrementAndGet();
        subfolder(customerRoot, subfolder).duplicates.incrementAndGet();
    }

    public void recordError() {
        errors.incrementAndGet();
    }

    public long processed() {
        return processed.get();
    }

    public long moved() {
        return moved.get();
    }

    public long duplicates() {
        return duplicates.get();
    }

    public long errors() {
        return errors.get();
    }

    public CrawlStatsSnapshot snapshot() {
        Map<String, CrawlStatsSnapshot.CustomerStats> customers = new TreeMap<>();
        byCustomer.forEach((customerRoot, counter) -> {
            Map<String, CrawlStatsSnapshot.SubfolderStats> subfolders = new TreeMap<>();
            bySubfolder.getOrDefault(customerRoot, Map.of()).forEach((name, sub) ->
                    subfolders.put(name, new CrawlStatsSnapshot.SubfolderStats(sub.processed.get(), sub.duplicates.get())));
            customers.put(customerRoot, new CrawlStatsSnapshot.CustomerStats(
                    counter.processed.get(), counter.duplicates.get(), Collections.unmodifiableMap(subfolders)));
        });
        return new CrawlStatsSnapshot(processed.get(), moved.get(), duplicates.get(), errors.get(),
                Collections.unmodifiableMap(customers));
    }

    private Counter customer(String customerRoot) {
        return byCustomer.computeIfAbsent(customerRoot, ignored -> new Counter());
    }

    private Counter subfolder(String customerRoot, String subfolder) {
        return bySubfolder.computeIfAbsent(customerRoot, ignored -> new ConcurrentHashMap<>())
                .computeIfAbsent(subfolder, ignored -> new Counter());
    }

    private static final class Counter {
        private final AtomicLong processed = new AtomicLong();
        private final AtomicLong duplicates = new AtomicLong();
    }
}
