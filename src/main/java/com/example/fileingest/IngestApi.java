package com.example.fileingest;

import com.example.fileingest.crawler.CrawlStatus;
import com.example.fileingest.index.DeleteResult;
import com.example.fileingest.index.PromoteResult;
import com.example.fileingest.index.QuarantinePage;
import com.example.fileingest.pipeline.BatchResult;
import com.example.fileingest.pipeline.ProcessingResult;
import com.example.fileingest.review.ConfirmResult;
import com.example.fileingest.review.ReviewFilter;
import com.example.fileingest.review.ReviewItem;
import com.example.fileingest.snapshot.RollbackResult;
import com.example.fileingest.snapshot.Snapshot;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Operation contracts of the control surface, one method per endpoint. A routing layer maps these
 * onto requests; errors surface as {@link ConflictException}, {@link NotFoundException} and
 * {@link ConfigurationException}.
 */
public final class IngestApi {
    public static final String STARTED = "started";
    public static final String CONFLICT = "conflict";
    public static final String STOPPING = "stopping";
    public static final String IDLE = "idle";

    private static final int DEFAULT_SNAPSHOT_LIMIT = 50;

    private final IngestContext context;

    public IngestApi(IngestContext context) {
        this.context = context;
    }

    /**
     * {@code POST crawler/start}. A crawl that is already running yields {@link #CONFLICT} and leaves
     * the running crawl untouched.
     */
    public CrawlerResponse startCrawler() {
        try {
            Instant startedAt = context.crawler().start();
            return new CrawlerResponse(STARTED, startedAt, null);
        } catch (ConflictException ex) {
            return new CrawlerResponse(CONFLICT, context.crawler().status().startedAt(), ex.getMessage());
        }
    }

    /**
     * {@code POST crawler/stop}.
     */
    public CrawlerResponse stopCrawler() {
        boolean stopping = context.crawler().stop();
        return new CrawlerResponse(stopping ? STOPPING : IDLE, context.crawler().status().startedAt(), null);
    }

    public CrawlStatus crawlerStatus() {
        return context.crawler().status();
    }

    public QuarantinePage listDuplicates(String customer, int limit, int offset) throws IOException {
        return context.quarantine().list(customer, limit, offset);
    }

    public PromoteResult promoteDuplicate(String path) throws IOException {
        return context.quarantine().promote(Path.of(path));
    }

    public Path moveDuplicate(String path, String targetDirectory) throws IOException {
        return context.quarantine().move(Path.of(path), Path.of(targetDirectory));
    }

    public DeleteResult deleteDuplicates(List<String> paths) {
        return context.quarantine().delete(paths.stream().map(Path::of).toList());
    }

    /**
     * {@code GET classification/pending}. Null bounds default to the full [0, 1] range.
     */
    public PendingResponse listPending(String customer, String project, Double minConfidence, Double maxConfidence) {
        ReviewFilter filter = ReviewFilter.all()
                .withCustomer(customer)
                .withProject(project)
                .withConfidence(minConfidence == null ? 0.0 : minConfidence, maxConfidence == null ? 1.0 : maxConfidence);
        List<ReviewItem> items = context.review().listPending(filter);
        return new PendingResponse(items, items.size());
    }

    public ConfirmResult confirm(String id, String category) throws IOException {
        return context.review().confirm(id, category);
    }

    public List<Snapshot> listSnapshots(Integer limit) throws IOException {
        return context.snapshots().list(null, null, limit == null ? DEFAULT_SNAPSHOT_LIMIT : limit);
    }

    public RollbackResult rollback(String snapshotId) throws IOException {
        return context.rollback().rollback(snapshotId);
    }

    public int cleanupSnapshots() throws IOException {
        return context.snapshots().cleanupOldSnapshots();
    }

    public ProcessingResult processFile(String path) {
        return context.orchestrator().process(Path.of(path));
    }

    public BatchResult processBatch(List<String> paths) {
        return context.orchestrator().processBatch(paths.stream().map(Path::of).toList());
    }

    public record CrawlerResponse(String status, Instant startedAt, String message) {
    }

    public record PendingResponse(List<ReviewItem> items, int total) {
        public PendingResponse {
            items = List.copyOf(items);
        }
    }
}
