package ai.pagetranslator.pipeline;

import ai.pagetranslator.document.PagedDocument;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the page pipeline for every page of a document concurrently, waits for all of them and then saves
 * the document once.
 *
 * <p>Failures are isolated per page: a failed page keeps its original text, the remaining pages are still
 * translated, and the report lists every page's outcome. Only a failing save aborts the run.
 */
public class PageScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(PageScheduler.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

    private final PagePipeline pipeline;
    private final int parallelism;

    public PageScheduler(PagePipeline pipeline, int parallelism) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        this.parallelism = parallelism;
    }

    /**
     * @throws ai.pagetranslator.document.PersistenceException if the document cannot be saved
     */
    public DocumentRunReport process(PagedDocument document, Path output) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(output, "output");
        long started = System.nanoTime();
        int pageCount = document.pageCount();
        LOGGER.info("Scheduling {} pages with parallelism {}", pageCount, parallelism);

        List<PageOutcome> outcomes = pageCount == 0 ? List.of() : runAll(document, pageCount);

        document.save(output);
        DocumentRunReport report = new DocumentRunReport(output, outcomes, Duration.ofNanos(System.nanoTime() - started));
        if (report.allSucceeded()) {
            LOGGER.info("Saved {}: {}", output, report.errorSummary());
        } else {
            LOGGER.warn("Saved {} with untranslated pages: {}", output, report.errorSummary());
        }
        return report;
    }

    private List<PageOutcome> runAll(PagedDocument document, int pageCount) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, pageCount));
        MdcPropagatingExecutor executor = new MdcPropagatingExecutor(pool);
        try {
            List<CompletableFuture<PageOutcome>> futures = new ArrayList<>(pageCount);
            for (int number = 1; number <= pageCount; number++) {
                int pageNumber = number;
                futures.add(CompletableFuture
                        .supplyAsync(() -> pipeline.run(document.page(pageNumber)), executor)
                        .exceptionally(error -> unexpected(pageNumber, error)));
            }

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            List<PageOutcome> outcomes = new ArrayList<>(pageCount);
            for (CompletableFuture<PageOutcome> future : futures) {
                outcomes.add(future.join());
            }
            return outcomes;
        } finally {
            shutdown(pool);
        }
    }

    private PageOutcome unexpected(int pageNumber, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        LOGGER.error("Page {} failed unexpectedly", pageNumber, cause);
        return PageOutcome.unexpected(pageNumber, cause);
    }

    private void shutdown(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOGGER.warn("Page executor did not terminate in time, forcing shutdown");
                pool.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }
}
