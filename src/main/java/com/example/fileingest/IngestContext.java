package com.example.fileingest;

import com.example.fileingest.content.ContentHasher;
import com.example.fileingest.content.FileMetadataExtractor;
import com.example.fileingest.content.FileMover;
import com.example.fileingest.content.PathClassifier;
import com.example.fileingest.crawler.Crawler;
import com.example.fileingest.document.BatchStore;
import com.example.fileingest.document.DocumentService;
import com.example.fileingest.document.DocumentStore;
import com.example.fileingest.index.HashIndex;
import com.example.fileingest.index.QuarantineService;
import com.example.fileingest.pipeline.Classifier;
import com.example.fileingest.pipeline.DocumentProcessingOrchestrator;
import com.example.fileingest.pipeline.FallbackClassifier;
import com.example.fileingest.pipeline.KeywordClassifier;
import com.example.fileingest.review.FeedbackLog;
import com.example.fileingest.review.ReviewService;
import com.example.fileingest.review.ReviewStore;
import com.example.fileingest.snapshot.RollbackService;
import com.example.fileingest.snapshot.SnapshotManager;
import com.example.fileingest.snapshot.SnapshotRepository;
import com.example.fileingest.storage.ObjectStorage;
import com.example.fileingest.storage.S3ObjectStorage;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Opens the persistent stores under {@code index_store_path} and wires the services on top of them.
 * Paths such as the central base and the store location are fixed for the lifetime of a context;
 * the crawler re-reads the rest of the configuration on every start.
 */
public final class IngestContext implements Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(IngestContext.class);

    private final IngestConfig config;
    private final HashIndex hashIndex;
    private final ReviewStore reviewStore;
    private final DocumentStore documentStore;
    private final BatchStore batchStore;
    private final ObjectStorage storage;
    private final Crawler crawler;
    private final QuarantineService quarantine;
    private final ReviewService review;
    private final SnapshotManager snapshots;
    private final RollbackService rollback;
    private final DocumentService documents;
    private final DocumentProcessingOrchestrator orchestrator;

    /**
     * @param model    classification model; null uses keyword rules only
     * @param storage  object storage; null derives it from the configuration
     */
    public IngestContext(ConfigSource configSource, Classifier model, ObjectStorage storage, Clock clock)
            throws IOException {
        this.config = configSource.load();
        ContentHasher hasher = new ContentHasher();
        FileMover mover = new FileMover();
        PathClassifier pathClassifier = new PathClassifier(
                config.internalRoots(), config.enableYearSubfolders(), config.yearFoldersUnder(), clock.getZone());

        this.hashIndex = new HashIndex(config.hashIndexFile());
        this.reviewStore = new ReviewStore(config.reviewStoreFile());
        this.documentStore = new DocumentStore(config.documentStoreFile());
        this.batchStore = new BatchStore(config.batchStoreFile());
        this.storage = storage != null ? storage : storageFor(config);

        this.crawler = new Crawler(configSource, hashIndex, reviewStore, hasher, mover, clock);
        this.quarantine = new QuarantineService(hashIndex, hasher, mover, pathClassifier, config.centralBase(),
                crawler::isRunning);
        this.review = new ReviewService(reviewStore, new FeedbackLog(config.feedbackLogFile()), pathClassifier, mover,
                config.centralBase(), clock);
        this.snapshots = new SnapshotManager(new SnapshotRepository(config.snapshotDirectory()), documentStore,
                batchStore, this.storage, clock, config.snapshotRetentionDays());
        this.rollback = new RollbackService(snapshots, documentStore, batchStore, this.storage, mover, clock);
        this.documents = new DocumentService(documentStore, snapshots, mover, clock, config.snapshotsEnabled());

        KeywordClassifier keywords = new KeywordClassifier();
        Classifier classifier = model == null ? keywords : new FallbackClassifier(model, keywords);
        this.orchestrator = new DocumentProcessingOrchestrator(config, new FileMetadataExtractor(new Tika(), hasher),
                classifier, documentStore, batchStore, reviewStore, snapshots, this.storage, mover, clock);
        LOGGER.info("Opened stores under {}", config.indexStorePath());
    }

    public static IngestContext open(Path configPath) throws IOException {
        return new IngestContext(ConfigSource.file(configPath), null, null, Clock.systemDefaultZone());
    }

    public IngestConfig config() {
        return config;
    }

    public Crawler crawler() {
        return crawler;
    }

    public HashIndex hashIndex() {
        return hashIndex;
    }

    public QuarantineService quarantine() {
        return quarantine;
    }

    public ReviewStore reviewStore() {
        return reviewStore;
    }

    public ReviewService review() {
        return review;
    }

    public SnapshotManager snapshots() {
        return snapshots;
    }

    public RollbackService rollback() {
        return rollback;
    }

    public DocumentStore documentStore() {
        return documentStore;
    }

    public BatchStore batchStore() {
        return batchStore;
    }

    public DocumentService documents() {
        return documents;
    }

    public DocumentProcessingOrchestrator orchestrator() {
        return orchestrator;
    }

    @Override
    public void close() throws IOException {
        try {
            crawler.close();
            orchestrator.close();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while stopping workers", ex);
        } finally {
            hashIndex.close();
            reviewStore.close();
            documentStore.close();
            batchStore.close();
            if (storage instanceof Closeable closeable) {
                closeable.close();
            }
        }
    }

    private static ObjectStorage storageFor(IngestConfig config) {
        if (!config.objectStorageEnabled()) {
            return ObjectStorage.none();
        }
        return new S3ObjectStorage(config.s3Bucket().get(), config.s3Prefix().orElse(""), config.s3Region());
    }
}
