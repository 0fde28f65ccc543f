package com.example.fileingest.crawler;

import com.example.fileingest.ConfigSource;
import com.example.fileingest.ConflictException;
import com.example.fileingest.IngestConfig;
import com.example.fileingest.IngestException;
import com.example.fileingest.content.ContentHasher;
import com.example.fileingest.content.FileMover;
import com.example.fileingest.content.PathClassifier;
import com.example.fileingest.index.DuplicateResolver;
import com.example.fileingest.index.HashIndex;
import com.example.fileingest.index.ObservedFile;
import com.example.fileingest.index.Resolution;
import com.example.fileingest.review.ReviewStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives a full pass over the configured shares: walks each share depth-first, hashes and classifies
 * every file and hands it to the {@link DuplicateResolver}, which moves it into the sorted tree.
 * <p>
 * At most one crawl runs at a time. {@link #stop()} is cooperative: the crawl thread checks the flag
 * before every directory and every file, so a file is never abandoned halfway through its move.
 * Per-file failures are counted and skipped.
 */
public final class Crawler implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(Crawler.class);

    private final ConfigSource configSource;
    private final HashIndex index;
    private final ReviewStore reviewStore;
    private final ContentHasher hasher;
    private final FileMover mover;
    private final CrawlListener listener;
    private final Clock clock;
    private final ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "crawler");
        thread.setDaemon(true);
        return thread;
    });

    private final AtomicReference<CrawlerState> state = new AtomicReference<>(CrawlerState.IDLE);
    private volatile boolean stopRequested;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;
    private volatile CrawlStats stats = new CrawlStats();
    private volatile Future<?> currentRun;

    public Crawler(ConfigSource configSource,
                   HashIndex index,
                   ReviewStore reviewStore,
                   ContentHasher hasher,
                   FileMover mover,
                   Clock clock) {
        this(configSource, index, reviewStore, hasher, mover, clock, CrawlListener.NONE);
    }

    public Crawler(ConfigSource configSource,
                   HashIndex index,
                   ReviewStore reviewStore,
                   ContentHasher hasher,
                   FileMover mover,
                   Clock clock,
                   CrawlListener listener) {
        this.configSource = configSource;
        this.index = index;
        this.reviewStore = reviewStore;
        this.hasher = hasher;
        this.mover = mover;
        this.clock = clock;
        this.listener = listener;
    }

    /**
     * Reads the configuration, resets counters and the index cache, and starts the crawl in the
     * background.
     *
     * @throws ConflictException                          if a crawl is already running
     * @throws com.example.fileingest.ConfigurationException if the configuration is unusable
     */
    public Instant start() {
        if (state.get() != CrawlerState.IDLE) {
            throw new ConflictException("Crawler already running");
        }
        IngestConfig config = configSource.load();
        if (!state.compareAndSet(CrawlerState.IDLE, CrawlerState.RUNNING)) {
            throw new ConflictException("Crawler already running");
        }
        stopRequested = false;
        stats = new CrawlStats();
        startedAt = clock.instant();
        finishedAt = null;
        try {
            index.reload();
        } catch (IOException ex) {
            finishedAt = clock.instant();
            state.set(CrawlerState.IDLE);
            throw new IngestException("Failed to load hash index", ex);
        }

        CrawlStats runStats = stats;
        LOGGER.info("Crawl started over {} share(s)", config.shares().size());
        currentRun = executor.submit(() -> runCrawl(config, runStats));
        return startedAt;
    }

    /**
     * Requests a cooperative stop.
     *
     * @return false if no crawl was running
     */
    public boolean stop() {
        if (state.get() == CrawlerState.IDLE) {
            return false;
        }
        stopRequested = true;
        state.compareAndSet(CrawlerState.RUNNING, CrawlerState.STOPPING);
        LOGGER.info("Crawl stop requested");
        return true;
    }

    public CrawlStatus status() {
        CrawlerState current = state.get();
        return new CrawlStatus(
                current,
                current != CrawlerState.IDLE,
                stopRequested,
                startedAt,
                finishedAt,
                stats.snapshot()
        );
    }

    public boolean isRunning() {
        return state.get() != CrawlerState.IDLE;
    }

    /**
     * Blocks until the current crawl (if any) has returned to idle.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        Future<?> run = currentRun;
        if (run == null) {
            return true;
        }
        try {
            run.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException ex) {
            return false;
        } catch (ExecutionException ex) {
            LOGGER.error("Crawl terminated abnormally", ex.getCause());
            return true;
        }
    }

    @Override
    public void close() throws InterruptedException {
        stop();
        executor.shutdown();
        if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
            LOGGER.warn("Crawler thread did not stop within one minute");
        }
    }

    private void runCrawl(IngestConfig config, CrawlStats runStats) {
        try {
            crawl(config, runStats);
        } catch (RuntimeException ex) {
            LOGGER.error("Crawl aborted", ex);
        } finally {
            boolean stopped = stopRequested;
            finishedAt = clock.instant();
            stopRequested = false;
            state.set(CrawlerState.IDLE);
            LOGGER.info("Crawl {}: processed={} moved={} duplicates={} errors={}",
                    stopped ? "stopped" : "completed",
                    runStats.processed(), runStats.moved(), runStats.duplicates(), runStats.errors());
        }
    }

    private void crawl(IngestConfig config, CrawlStats runStats) {
        PathClassifier classifier = new PathClassifier(
                config.internalRoots(), config.enableYearSubfolders(), config.yearFoldersUnder());
        DuplicateResolver resolver = new DuplicateResolver(index, mover, classifier, config.centralBase());
        Walk walk = new Walk(config, classifier, resolver, runStats, reviewStore.pendingPaths());

        for (Path share : config.shares()) {
            if (stopRequested) {
                return;
            }
            if (!Files.isDirectory(share)) {
                LOGGER.warn("Share {} is not a readable directory", share);
                runStats.recordError();
                continue;
            }
            if (!walk.share(share)) {
                return;
            }
        }
    }

    /**
     * Per-run walking state.
     */
    private final class Walk {
        private final IngestConfig config;
        private final PathClassifier classifier;
        private final DuplicateResolver resolver;
        private final CrawlStats runStats;
        private final Set<Path> pendingReview;
        private final List<PathMatcher> fileExcludes;
        private final List<PathMatcher> directoryExcludes;
        private final LinkOption[] linkOptions;

        private Walk(IngestConfig config,
                     PathClassifier classifier,
                     DuplicateResolver resolver,
                     CrawlStats runStats,
                     Set<Path> pendingReview) {
            this.config = config;
            this.classifier = classifier;
            this.resolver = resolver;
            this.runStats = runStats;
            this.pendingReview = pendingReview;
            this.fileExcludes = matchers(config.excludeFilePatterns());
            this.directoryExcludes = matchers(config.excludeDirectoryPatterns());
            this.linkOptions = config.followLinks() ? new LinkOption[0] : new LinkOption[]{LinkOption.NOFOLLOW_LINKS};
        }

        /**
         * @return false if the walk ended because a stop was requested
         */
        private boolean share(Path share) {
            Deque<Path> pending = new ArrayDeque<>();
            pending.push(share);
            while (!pending.isEmpty()) {
                if (stopRequested) {
                    return false;
                }
                Path directory = pending.pop();
                List<Path> files = new ArrayList<>();
                List<Path> subdirectories = new ArrayList<>();
                if (!list(directory, files, subdirectories)) {
                    continue;
                }
                for (Path file : files) {
                    if (stopRequested) {
                        return false;
                    }
                    processFile(file);
                }
                // Push in reverse so the alphabetically first subdirectory is walked next.
                for (int i = subdirectories.size() - 1; i >= 0; i--) {
                    pending.push(subdirectories.get(i));
                }
            }
            return true;
        }

        private boolean list(Path directory, List<Path> files, List<Path> subdirectories) {
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
                for (Path entry : stream) {
                    if (!config.followLinks() && Files.isSymbolicLink(entry)) {
                        continue;
                    }
                    if (Files.isDirectory(entry, linkOptions)) {
                        if (!skipDirectory(entry)) {
                            subdirectories.add(entry);
                        }
                    } else if (Files.isRegularFile(entry, linkOptions) && !excluded(entry, fileExcludes)) {
                        files.add(entry);
                    }
                }
            } catch (IOException ex) {
                LOGGER.warn("Failed to list directory {}", directory, ex);
                runStats.recordError();
                return false;
            }
            files.sort(Comparator.comparing(path -> path.getFileName().toString()));
            subdirectories.sort(Comparator.comparing(path -> path.getFileName().toString()));
            return true;
        }

        private void processFile(Path file) {
            Path normalized = file.toAbsolutePath().normalize();
            if (pendingReview.contains(normalized)) {
                LOGGER.debug("Skipping {} while it awaits review", file);
                return;
            }
            try {
                BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class, linkOptions);
                String digest = hasher.hash(file);
                String customerRoot = classifier.customerRoot(normalized);
                String subfolder = classifier.subfolder(normalized);
                Instant modified = attrs.lastModifiedTime().toInstant();
                runStats.recordProcessed(customerRoot, subfolder);

                Path destination = classifier.targetDirectory(config.centralBase(), customerRoot, subfolder, modified);
                Resolution resolution = resolver.resolve(new ObservedFile(
                        digest, normalized, attrs.size(), modified, customerRoot, subfolder, destination));
                if (resolution.outcome().moved()) {
                    runStats.recordMoved();
                }
                if (resolution.outcome().duplicate()) {
                    runStats.recordDuplicate(customerRoot, subfolder);
                }
                listener.fileResolved(normalized, resolution);
            } catch (IOException | RuntimeException ex) {
                LOGGER.warn("Failed to process {}", file, ex);
                runStats.recordError();
            }
        }

        private boolean skipDirectory(Path directory) {
            return PathClassifier.QUARANTINE_DIRECTORY.equals(directory.getFileName().toString())
                    || excluded(directory, directoryExcludes);
        }

        private boolean excluded(Path path, List<PathMatcher> matchers) {
            Path name = path.getFileName();
            for (PathMatcher matcher : matchers) {
                if (matcher.matches(name)) {
                    return true;
                }
            }
            return false;
        }

        private List<PathMatcher> matchers(List<String> patterns) {
            List<PathMatcher> result = new ArrayList<>(patterns.size());
            for (String pattern : patterns) {
                result.add(FileSystems.getDefault().getPathMatcher("glob:" + escapeGlob(pattern)));
            }
            return result;
        }

        private String escapeGlob(String pattern) {
            // Names such as "$RECYCLE.BIN" are literal; only * and ? act as wildcards.
            return pattern.replace("\\", "\\\\").replace("[", "\\[").replace("{", "\\{");
        }
    }
}
