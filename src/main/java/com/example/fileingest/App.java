package com.example.fileingest;

import com.example.fileingest.crawler.CrawlStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    private static final String USAGE = "Usage: java -jar file-ingest.jar <config.yaml> "
            + "<crawl|process <file...>|snapshots [limit]|rollback <id>|cleanup|duplicates [customer]|pending>";

    private App() {
    }

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            LOGGER.error(USAGE);
            System.exit(1);
        }
        Path configPath = Path.of(args[0]);
        String command = args[1];
        List<String> operands = Arrays.asList(args).subList(2, args.length);
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);

        try (IngestContext context = IngestContext.open(configPath)) {
            IngestApi api = new IngestApi(context);
            Object result = switch (command) {
                case "crawl" -> crawl(context, api);
                case "process" -> {
                    requireOperands(operands, 1);
                    yield operands.size() == 1 ? api.processFile(operands.get(0)) : api.processBatch(operands);
                }
                case "snapshots" -> api.listSnapshots(operands.isEmpty() ? null : Integer.valueOf(operands.get(0)));
                case "rollback" -> {
                    requireOperands(operands, 1);
                    yield api.rollback(operands.get(0));
                }
                case "cleanup" -> api.cleanupSnapshots();
                case "duplicates" -> api.listDuplicates(operands.isEmpty() ? null : operands.get(0), 100, 0);
                case "pending" -> api.listPending(null, null, null, null);
                default -> {
                    LOGGER.error("Unknown command {}. {}", command, USAGE);
                    System.exit(1);
                    yield null;
                }
            };
            System.out.println(mapper.writeValueAsString(result));
        } catch (IngestException ex) {
            LOGGER.error("{} failed: {}", command, ex.getMessage(), ex);
            System.exit(2);
        }
    }

    private static CrawlStatus crawl(IngestContext context, IngestApi api) throws InterruptedException {
        IngestApi.CrawlerResponse response = api.startCrawler();
        if (!IngestApi.STARTED.equals(response.status())) {
            throw new ConflictException(response.message());
        }
        while (!context.crawler().awaitIdle(Duration.ofSeconds(30))) {
            LOGGER.info("Crawl progress: {}", api.crawlerStatus().stats());
        }
        return api.crawlerStatus();
    }

    private static void requireOperands(List<String> operands, int minimum) {
        if (operands.size() < minimum) {
            LOGGER.error(USAGE);
            System.exit(1);
        }
    }
}
