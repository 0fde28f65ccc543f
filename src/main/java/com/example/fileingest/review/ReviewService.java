package com.example.fileingest.review;

import com.example.fileingest.NotFoundException;
import com.example.fileingest.content.FileMover;
import com.example.fileingest.content.PathClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Operator side of the review queue: list pending suggestions and confirm a category.
 * Confirmed files are placed with the same layout rules the crawler uses.
 */
public final class ReviewService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReviewService.class);

    private final ReviewStore store;
    private final FeedbackLog feedbackLog;
    private final PathClassifier classifier;
    private final FileMover mover;
    private final Path centralBase;
    private final Clock clock;

    public ReviewService(ReviewStore store,
                         FeedbackLog feedbackLog,
                         PathClassifier classifier,
                         FileMover mover,
                         Path centralBase,
                         Clock clock) {
        this.store = store;
        this.feedbackLog = feedbackLog;
        this.classifier = classifier;
        this.mover = mover;
        this.centralBase = centralBase;
        this.clock = clock;
    }

    public List<ReviewItem> listPending(ReviewFilter filter) {
        return store.listPending(filter == null ? ReviewFilter.all() : filter);
    }

    /**
     * Moves the reviewed file to the directory for {@code category}, logs the decision and removes
     * the item from the queue.
     *
     * @throws NotFoundException if the item or its file no longer exists
     */
    public ConfirmResult confirm(String id, String category) throws IOException {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("category must not be blank");
        }
        ReviewItem item = store.get(id)
                .orElseThrow(() -> new NotFoundException("Review item not found: " + id));
        Path original = Path.of(item.originalPath());
        if (!Files.isRegularFile(original)) {
            throw new NotFoundException("File for review item " + id + " not found: " + original);
        }

        String customerRoot = classifier.customerRoot(original);
        String subfolder = classifier.subfolderForCategory(category);
        Instant modified = Files.getLastModifiedTime(original).toInstant();
        Path directory = classifier.targetDirectory(centralBase, customerRoot, subfolder, modified);
        Path destination = mover.moveInto(original, directory);

        feedbackLog.append(new FeedbackRecord(
                id,
                category,
                item.suggestedCategory(),
                item.confidence(),
                item.customer(),
                item.project(),
                item.filename(),
                destination.toString(),
                clock.instant()
        ));
        store.delete(id);
        LOGGER.info("Confirmed review {} as {} (suggested {}); moved to {}",
                id, category, item.suggestedCategory(), destination);
        return new ConfirmResult(id, category, destination);
    }
}
