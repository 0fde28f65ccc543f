package com.example.fileingest.pipeline;

import com.example.fileingest.IngestConfig;
import com.example.fileingest.IngestException;
import com.example.fileingest.content.FileMetadata;
import com.example.fileingest.content.FileMetadataExtractor;
import com.example.fileingest.content.FileMover;
import com.example.fileingest.document.BatchRecord;
import com.example.fileingest.document.BatchStatus;
import com.example.fileingest.document.BatchStore;
import com.example.fileingest.document.DocumentClassification;
import com.example.fileingest.document.DocumentRecord;
import com.example.fileingest.document.DocumentStatus;
import com.example.fileingest.document.DocumentStore;
import com.example.fileingest.review.ReviewItem;
import com.example.fileingest.review.ReviewStore;
import com.example.fileingest.snapshot.RollbackOperation;
import com.example.fileingest.snapshot.Snapshot;
import com.example.fileingest.snapshot.SnapshotManager;
import com.example.fileingest.snapshot.SnapshotSubject;
import com.example.fileingest.storage.ObjectStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Places single files and batches outside of a crawl: duplicate check, classification, optional
 * backup, move and persistence of the document record.
 * <p>
 * Every file is planned first (digest, duplicate check, classification, destination). The snapshot
 * is written after planning and before the first file is touched, so it always knows where each
 * file is going.
 * <p>
 * A digest is claimed from the duplicate check until its document record is written, so two runs
 * placing identical content at the same time yield one document and one duplicate.
 */
public final class DocumentProcessingOrchestrator implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentProcessingOrchestrator.class);
    private static final int CONTENT_PREVIEW_CHARS = 2000;
    private static final DateTimeFormatter BACKUP_FOLDER = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    public static final String META_SOURCE_PATH = "source_path";
    public static final String META_MIME_TYPE = "mime_type";
    public static final String META_BACKUP_PATH = "backup_path";
    public static final String META_CLASSIFIED_BY = "classified_by";

    private final FileMetadataExtractor extractor;
    private final Classifier classifier;
    private final TargetPathResolver targets;
    private final DocumentStore documents;
    private final BatchStore batches;
    private final ReviewStore reviews;
    private final SnapshotManager snapshots;
    private final ObjectStorage storage;
    private final FileMover mover;
    private final Clock clock;
    private final double reviewThreshold;
    private final boolean snapshotsEnabled;
    private final boolean backupEnabled;
    private final Path backupDirectory;
    private final ExecutorService workers;
    private final ConcurrentMap<String, Path> claims = new ConcurrentHashMap<>();

    public DocumentProcessingOrchestrator(IngestConfig config,
                                          FileMetadataExtractor extractor,
                                          Classifier classifier,
                                          DocumentStore documents,
                                          BatchStore batches,
                                          ReviewStore reviews,
                                          SnapshotManager snapshots,
                                          ObjectStorage storage,
                                          FileMover mover,
                                          Clock clock) {
        this.extractor = extractor;
        this.classifier = classifier;
        this.targets = new TargetPathResolver(config.centralBase(), config.categoryPaths(), clock.getZone());
        this.documents = documents;
        this.batches = batches;
        this.reviews = reviews;
        this.snapshots = snapshots;
        this.storage = storage;
        this.mover = mover;
        this.clock = clock;
        this.reviewThreshold = config.reviewConfidenceThreshold();
        this.snapshotsEnabled = config.snapshotsEnabled();
        this.backupEnabled = config.backupEnabled();
        this.backupDirectory = config.backupDirectory();
        AtomicInteger threadCounter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(config.processingWorkers(), runnable -> {
            Thread thread = new Thread(runnable, "document-worker-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Runs the pipeline for one file. Failures are reported in the result rather than thrown.
     */
    public ProcessingResult process(Path source) {
        Analysis analysis = analyze(source.toAbsolutePath().normalize());
        if (analysis.failure() != null) {
            return analysis.failure();
        }
        Decision decision = decide(analysis, new HashSet<>(), null);
        if (decision.terminal() != null) {
            release(decision.claim());
            return decision.terminal();
        }
        ProcessingPlan plan = decision.plan();
        String snapshotId = null;
        if (snapshotsEnabled) {
            try {
                Snapshot snapshot = snapshots.create(
                        RollbackOperation.FILE_PROCESSING,
                        List.of(subject(plan)),
                        null,
                        "Process " + plan.file().name(),
                        Map.of(META_SOURCE_PATH, plan.source().toString())
                );
                snapshotId = snapshot.id();
            } catch (IOException ex) {
                LOGGER.error("Failed to snapshot {}; file left in place", plan.source(), ex);
                release(plan.documentId());
                return ProcessingResult.failed(plan.source().toString(), plan.documentId(), null,
                        "Snapshot failed: " + ex.getMessage());
            }
        }
        return execute(plan, null, snapshotId);
    }

    /**
     * Runs the pipeline over several files on the worker pool. Returns one result per input in input
     * order. Files moved by the batch share one snapshot.
     */
    public BatchResult processBatch(List<Path> sources) {
        String batchId = "batch_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        BatchRecord batch = new BatchRecord(batchId, BatchStatus.RUNNING, sources.size(), 0, 0, clock.instant(), null);
        try {
            batches.put(batch);
        } catch (IOException ex) {
            throw new IngestException("Failed to register batch " + batchId, ex);
        }
        LOGGER.info("Batch {} started with {} file(s)", batchId, sources.size());

        List<Analysis> analyses = runAll(sources.stream()
                .map(source -> (Callable<Analysis>) () -> analyze(source.toAbsolutePath().normalize()))
                .toList());

        ProcessingResult[] results = new ProcessingResult[sources.size()];
        List<ProcessingPlan> plans = new ArrayList<>();
        List<Integer> planIndexes = new ArrayList<>();
        Set<Path> reserved = new HashSet<>();
        List<String> settled = new ArrayList<>();
        for (int i = 0; i < analyses.size(); i++) {
            Analysis analysis = analyses.get(i);
            if (analysis.failure() != null) {
                results[i] = analysis.failure();
                continue;
            }
            Decision decision = decide(analysis, reserved, batchId);
            if (decision.terminal() != null) {
                results[i] = decision.terminal();
                settled.add(decision.claim());
            } else {
                plans.add(decision.plan());
                planIndexes.add(i);
            }
        }

        String snapshotId = null;
        boolean snapshotFailed = false;
        if (snapshotsEnabled && !plans.isEmpty()) {
            try {
                snapshotId = snapshots.create(
                        RollbackOperation.BATCH_PROCESSING,
                        plans.stream().map(this::subject).toList(),
                        batchId,
                        "Batch " + batchId,
                        Map.of("batch_size", String.valueOf(sources.size()))
                ).id();
            } catch (IOException ex) {
                LOGGER.error("Failed to snapshot batch {}; no files moved", batchId, ex);
                snapshotFailed = true;
            }
        }
        settled.forEach(this::release);

        if (snapshotFailed) {
            for (int p = 0; p < plans.size(); p++) {
                ProcessingPlan plan = plans.get(p);
                release(plan.documentId());
                results[planIndexes.get(p)] = ProcessingResult.failed(plan.source().toString(), plan.documentId(),
                        null, "Snapshot failed");
            }
        } else {
            String batchSnapshot = snapshotId;
            List<ProcessingResult> executed = runAll(plans.stream()
                    .map(plan -> (Callable<ProcessingResult>) () -> execute(plan, batchId, batchSnapshot))
                    .toList());
            for (int p = 0; p < executed.size(); p++) {
                results[planIndexes.get(p)] = executed.get(p);
            }
        }

        BatchResult result = new BatchResult(batchId, snapshotId, List.of(results));
        int failed = (int) result.count(ProcessingStatus.FAILED);
        try {
            batches.put(batch.withCounters(result.total() - failed, failed).complete(clock.instant()));
        } catch (IOException ex) {
            LOGGER.warn("Failed to update counters of batch {}", batchId, ex);
        }
        LOGGER.info("Batch {} finished: processed={} duplicates={} review={} failed={}", batchId,
                result.count(ProcessingStatus.PROCESSED), result.count(ProcessingStatus.DUPLICATE),
                result.count(ProcessingStatus.REVIEW), failed);
        return result;
    }

    @Override
    public void close() throws InterruptedException {
        workers.shutdown();
        if (!workers.awaitTermination(1, TimeUnit.MINUTES)) {
            LOGGER.warn("Document workers did not stop within one minute");
        }
    }

    private Analysis analyze(Path source) {
        try {
            FileMetadata file = extractor.extract(source);
            ClassificationResult classification = classifier.classify(contentOf(source, file));
            return new Analysis(source, file, classification, null);
        } catch (IOException | RuntimeException ex) {
            LOGGER.warn("Failed to analyze {}", source, ex);
            return new Analysis(source, null, null,
                    ProcessingResult.failed(source.toString(), null, null, ex.getMessage()));
        }
    }

    /**
     * Duplicate check, review routing and destination reservation. Runs on the calling thread.
     * <p>
     * Claims the digest first. A plan keeps its claim until {@link #execute} ends; a terminal decision
     * names the claim the caller must release.
     *
     * @param reserved destinations already claimed in this run
     */
    private Decision decide(Analysis analysis, Set<Path> reserved, String batchId) {
        FileMetadata file = analysis.file();
        String id = file.hashSha256();
        String source = analysis.source().toString();
        ClassificationResult classification = analysis.classification();

        Path claimant = claims.putIfAbsent(id, analysis.source());
        if (claimant != null) {
            return Decision.done(new ProcessingResult(ProcessingStatus.DUPLICATE, source, id, null,
                    claimant.toString(), null, null, classification, "Duplicate of " + claimant + " (in progress)"),
                    null);
        }
        Optional<DocumentRecord> existing = documents.get(id);
        if (existing.isPresent()) {
            release(id);
            return Decision.done(new ProcessingResult(ProcessingStatus.DUPLICATE, source, id, null,
                    existing.get().currentPath(), null, null, classification,
                    "Duplicate of " + existing.get().currentPath()), null);
        }

        if (classification.confidence() < reviewThreshold) {
            return Decision.done(queueForReview(analysis, batchId), id);
        }

        Path target;
        try {
            Path directory = targets.directoryFor(classification, file.lastModifiedTime());
            target = mover.uniqueTarget(directory, file.name(), reserved);
        } catch (RuntimeException ex) {
            LOGGER.warn("No destination for {}", source, ex);
            return Decision.done(ProcessingResult.failed(source, id, null, ex.getMessage()), id);
        }
        reserved.add(target);
        return Decision.move(new ProcessingPlan(analysis.source(), file, classification, target));
    }

    private ProcessingResult queueForReview(Analysis analysis, String batchId) {
        FileMetadata file = analysis.file();
        ClassificationResult classification = analysis.classification();
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("digest", file.hashSha256());
        metadata.put(META_MIME_TYPE, file.mimeType());
        metadata.put(META_CLASSIFIED_BY, Objects.toString(classification.source(), "unknown"));
        if (batchId != null) {
            metadata.put("batch_id", batchId);
        }
        ReviewItem item;
        try {
            item = new ReviewItem(
                    UUID.randomUUID().toString(),
                    analysis.source().toString(),
                    file.name(),
                    file.size(),
                    file.lastModifiedTime(),
                    classification.category(),
                    classification.confidence(),
                    classification.customer(),
                    classification.project(),
                    classification.tags(),
                    metadata
            );
            reviews.add(item);
        } catch (IOException | RuntimeException ex) {
            LOGGER.warn("Failed to queue {} for review", analysis.source(), ex);
            return ProcessingResult.failed(analysis.source().toString(), file.hashSha256(), null, ex.getMessage());
        }
        LOGGER.info("Queued {} for review ({} at {})", file.name(), classification.category(), classification.confidence());
        return new ProcessingResult(ProcessingStatus.REVIEW, analysis.source().toString(), file.hashSha256(), null,
                null, item.id(), null, classification, "Confidence below " + reviewThreshold);
    }

    private ProcessingResult execute(ProcessingPlan plan, String batchId, String snapshotId) {
        String source = plan.source().toString();
        try {
            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put(META_SOURCE_PATH, source);
            metadata.put(META_MIME_TYPE, plan.file().mimeType());
            metadata.put(META_CLASSIFIED_BY, Objects.toString(plan.classification().source(), "unknown"));
            if (backupEnabled) {
                metadata.put(META_BACKUP_PATH, backup(plan.source()).toString());
            }

            Path placed = mover.move(plan.source(), plan.target());
            String storageKey = upload(plan, placed, metadata);

            Instant now = clock.instant();
            ClassificationResult classification = plan.classification();
            documents.put(new DocumentRecord(
                    plan.documentId(),
                    plan.file().name(),
                    source,
                    placed.toString(),
                    plan.file().size(),
                    plan.file().mimeType(),
                    DocumentStatus.PROCESSED,
                    new DocumentClassification(classification.category(), classification.confidence(),
                            classification.customer(), classification.project()),
                    classification.tags(),
                    metadata,
                    batchId,
                    storageKey,
                    now,
                    now
            ));
            LOGGER.info("Placed {} at {}", source, placed);
            return new ProcessingResult(ProcessingStatus.PROCESSED, source, plan.documentId(), placed.toString(),
                    null, null, snapshotId, classification, null);
        } catch (IOException | RuntimeException ex) {
            LOGGER.warn("Failed to place {}{}", source,
                    snapshotId == null ? "" : "; roll back with snapshot " + snapshotId, ex);
            return ProcessingResult.failed(source, plan.documentId(), snapshotId, ex.getMessage());
        } finally {
            release(plan.documentId());
        }
    }

    private void release(String digest) {
        if (digest != null) {
            claims.remove(digest);
        }
    }

    private Path backup(Path source) throws IOException {
        Path folder = backupDirectory.resolve(BACKUP_FOLDER.format(clock.instant().atZone(clock.getZone())));
        Path copy = mover.copy(source, mover.uniqueTarget(folder, source.getFileName().toString()));
        LOGGER.debug("Backed up {} to {}", source, copy);
        return copy;
    }

    /**
     * @return the object key, or null when storage is disabled or the upload failed
     */
    private String upload(ProcessingPlan plan, Path placed, Map<String, String> metadata) {
        if (!storage.enabled()) {
            return null;
        }
        String key = ObjectStorage.keyFor(plan.documentId(), plan.file().name());
        try {
            storage.upload(key, placed, metadata);
            return key;
        } catch (IOException ex) {
            LOGGER.warn("Failed to upload {}; document kept locally", placed, ex);
            return null;
        }
    }

    private SnapshotSubject subject(ProcessingPlan plan) {
        String key = storage.enabled() ? ObjectStorage.keyFor(plan.documentId(), plan.file().name()) : null;
        return new SnapshotSubject(plan.documentId(), plan.source(), plan.target(), key);
    }

    private String contentOf(Path source, FileMetadata file) throws IOException {
        if (!file.isText()) {
            return file.name();
        }
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        char[] buffer = new char[CONTENT_PREVIEW_CHARS];
        int filled = 0;
        try (Reader reader = new InputStreamReader(Files.newInputStream(source), decoder)) {
            int read;
            while (filled < buffer.length && (read = reader.read(buffer, filled, buffer.length - filled)) != -1) {
                filled += read;
            }
        }
        return new String(buffer, 0, filled);
    }

    private <T> List<T> runAll(List<Callable<T>> tasks) {
        List<T> results = new ArrayList<>(tasks.size());
        try {
            for (Future<T> future : workers.invokeAll(tasks)) {
                results.add(future.get());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IngestException("Interrupted while processing batch", ex);
        } catch (ExecutionException ex) {
            throw new IngestException("Batch worker failed", ex.getCause());
        }
        return results;
    }

    private record Analysis(Path source, FileMetadata file, ClassificationResult classification,
                            ProcessingResult failure) {
    }

    private record Decision(ProcessingPlan plan, ProcessingResult terminal, String claim) {
        static Decision move(ProcessingPlan plan) {
            return new Decision(plan, null, null);
        }

        static Decision done(ProcessingResult result, String claim) {
            return new Decision(null, result, claim);
        }
    }
}
