package com.example.fileingest;

import com.example.fileingest.crawler.CrawlStatus;
import com.example.fileingest.crawler.CrawlerState;
import com.example.fileingest.index.QuarantinePage;
import com.example.fileingest.pipeline.BatchResult;
import com.example.fileingest.pipeline.ProcessingResult;
import com.example.fileingest.pipeline.ProcessingStatus;
import com.example.fileingest.review.ConfirmResult;
import com.example.fileingest.snapshot.RollbackResult;
import com.example.fileingest.snapshot.Snapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IngestApiTest {
    private static final Instant NOW = Instant.parse("2024-03-02T09:00:00Z");
    private static final FileTime MODIFIED = FileTime.from(Instant.parse("2023-05-10T12:00:00Z"));

    private Path root;
    private Path tree;
    private Path central;
    private IngestContext context;
    private IngestApi api;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("api");
        tree = Files.createDirectories(root.resolve("tree"));
        central = root.resolve("central");
        IngestConfig config = TestConfigs.config(List.of(tree), central, root.resolve("state"));
        context = new IngestContext(ConfigSource.fixed(config), null, null, Clock.fixed(NOW, ZoneOffset.UTC));
        api = new IngestApi(context);
    }

    @AfterEach
    void tearDown() throws Exception {
        context.close();
    }

    @Test
    void crawlThroughTheApiQuarantinesDuplicates() throws Exception {
        write(tree.resolve("ORGA/a.txt"), "same bytes");
        write(tree.resolve("ORGA/copy/b.txt"), "same bytes");

        IngestApi.CrawlerResponse started = api.startCrawler();
        assertTrue(context.crawler().awaitIdle(Duration.ofSeconds(10)));

        assertEquals(IngestApi.STARTED, started.status());
        assertEquals(NOW, started.startedAt());
        CrawlStatus status = api.crawlerStatus();
        assertEquals(CrawlerState.IDLE, status.state());
        assertEquals(2, status.stats().processed());
        assertEquals(1, status.stats().duplicates());

        QuarantinePage page = api.listDuplicates("ORGA", 10, 0);
        assertEquals(1, page.total());
        assertEquals("b.txt", page.items().get(0).name());
        assertEquals(0, api.listDuplicates("INFRA", 10, 0).total());
    }

    @Test
    void stopWhileIdleReportsIdle() {
        assertEquals(IngestApi.IDLE, api.stopCrawler().status());
        assertFalse(api.crawlerStatus().running());
    }

    @Test
    void pendingItemsCanBeFilteredAndConfirmed() throws Exception {
        Path file = write(tree.resolve("notes.txt"), "lorem ipsum dolor");
        ProcessingResult result = api.processFile(file.toString());
        assertEquals(ProcessingStatus.REVIEW, result.status());

        IngestApi.PendingResponse pending = api.listPending(null, null, null, null);
        assertEquals(1, pending.total());
        assertEquals(0, api.listPending(null, null, 0.5, null).total());
        assertEquals(0, api.listPending("9999_Nobody", null, null, null).total());

        ConfirmResult confirmed = api.confirm(result.reviewId(), "finanzen");

        Path expected = central.resolve("ALLGEMEIN/Archiv/notes.txt");
        assertEquals(expected, confirmed.destination());
        assertTrue(Files.exists(expected));
        assertEquals(0, api.listPending(null, null, null, null).total());
        assertThrows(NotFoundException.class, () -> api.confirm(result.reviewId(), "finanzen"));
    }

    @Test
    void processedFileCanBeRolledBackBySnapshot() throws Exception {
        Path file = write(tree.resolve("invoice.txt"), "Invoice 42 for 12345_Acme");

        ProcessingResult result = api.processFile(file.toString());
        assertEquals(ProcessingStatus.PROCESSED, result.status(), result.message());
        assertFalse(Files.exists(file));

        List<Snapshot> snapshots = api.listSnapshots(null);
        assertEquals(1, snapshots.size());
        assertEquals(result.snapshotId(), snapshots.get(0).id());

        RollbackResult rollback = api.rollback(result.snapshotId());

        assertTrue(rollback.success(), rollback.errors().toString());
        assertTrue(Files.exists(file));
        assertTrue(context.documentStore().get(result.documentId()).isEmpty());
        assertEquals(0, api.cleanupSnapshots());
        assertThrows(NotFoundException.class, () -> api.rollback("snapshot_20200101_000000_classification_0000abcd"));
    }

    @Test
    void batchEndpointReturnsOneResultPerPath() throws Exception {
        Path first = write(tree.resolve("in/a.txt"), "Zahlung fuer 12345_Acme");
        Path second = write(tree.resolve("in/b.txt"), "lorem ipsum");

        BatchResult result = api.processBatch(List.of(first.toString(), second.toString()));

        assertEquals(2, result.total());
        assertEquals(ProcessingStatus.PROCESSED, result.results().get(0).status());
        assertEquals(ProcessingStatus.REVIEW, result.results().get(1).status());
        assertTrue(context.batchStore().get(result.batchId()).isPresent());
    }

    private static Path write(Path file, String content) throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        Files.setLastModifiedTime(file, MODIFIED);
        return file;
    }
}
