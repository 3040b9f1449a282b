package com.foiarelay.directory.scrape;

import com.foiarelay.config.DirectoryProperties;
import com.foiarelay.directory.extract.ContactExtractor;
import com.foiarelay.directory.model.ExtractedContact;
import com.foiarelay.directory.model.PageSnapshot;
import com.foiarelay.directory.model.ScrapedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Visits every unit page with a fixed set of reusable workers.
 *
 * <p>Ids are processed in consecutive batches of {@code concurrency}; task {@code j} of a
 * batch always runs on worker {@code j}, and a batch is fully awaited before the next one
 * starts, so at most {@code concurrency} pages are open at once. The result for input
 * index {@code i} always lands at output index {@code i}. A task that fails or exceeds the
 * per-task timeout yields a placeholder record instead of aborting the batch.
 */
@Service
public class ScraperPool {
    private static final Logger log = LoggerFactory.getLogger(ScraperPool.class);

    private final DirectoryProperties properties;
    private final PageSessionFactory sessionFactory;
    private final ContactExtractor extractor;

    public ScraperPool(DirectoryProperties properties, PageSessionFactory sessionFactory, ContactExtractor extractor) {
        this.properties = properties;
        this.sessionFactory = sessionFactory;
        this.extractor = extractor;
    }

    public List<ScrapedRecord> scrape(List<String> unitIds) {
        return scrape(unitIds, properties.getScrape().getConcurrency());
    }

    public List<ScrapedRecord> scrape(List<String> unitIds, int concurrency) {
        if (unitIds == null || unitIds.isEmpty()) {
            return List.of();
        }
        int total = unitIds.size();
        int workerCount = Math.min(Math.max(1, concurrency), total);
        long taskTimeoutMs = TimeUnit.SECONDS.toMillis(properties.getScrape().getTaskTimeoutSeconds());
        ScrapedRecord[] results = new ScrapedRecord[total];
        int withEmail = 0;

        log.info("Scraping {} unit page(s) with {} {} worker(s)", total, workerCount, sessionFactory.engine());
        List<ScrapeWorker> workers = new ArrayList<>(workerCount);
        try {
            for (int i = 0; i < workerCount; i++) {
                workers.add(new ScrapeWorker(i, sessionFactory));
            }

            for (int start = 0; start < total; start += workerCount) {
                int end = Math.min(total, start + workerCount);
                List<PendingVisit> batch = new ArrayList<>(end - start);
                for (int i = start; i < end; i++) {
                    String unitId = unitIds.get(i);
                    CompletableFuture<Long> startedAt = new CompletableFuture<>();
                    Future<ScrapedRecord> result = workers.get(i - start).submit(
                        () -> startedAt.complete(System.nanoTime()),
                        session -> visit(session, unitId)
                    );
                    batch.add(new PendingVisit(unitId, startedAt, result));
                }
                for (int i = start; i < end; i++) {
                    ScrapedRecord record = await(batch.get(i - start), taskTimeoutMs);
                    results[i] = record;
                    if (record.hasEmail()) {
                        withEmail++;
                    }
                }
                int progress = (int) Math.round(end * 100.0 / total);
                log.info("[{}-{}/{}] ({}%) scraped, {} with email so far", start + 1, end, total, progress, withEmail);
            }
        } finally {
            for (ScrapeWorker worker : workers) {
                worker.close();
            }
        }
        log.info("Scrape finished: {} unit(s), {} with email, {} without", total, withEmail, total - withEmail);
        return List.copyOf(Arrays.asList(results));
    }

    /**
     * Two-phase visit: REVEAL drives the page (navigate, settle, click the info tab), then
     * EXTRACT runs the pure heuristics over the captured snapshot.
     */
    ScrapedRecord visit(PageSession session, String unitId) {
        DirectoryProperties.Scrape scrape = properties.getScrape();
        String url = scrape.pageUrlFor(unitId);
        session.navigate(url, Duration.ofMillis(scrape.getNavigationTimeoutMs()));
        session.settle(Duration.ofMillis(scrape.getInitialSettleMs()));
        session.reveal(scrape.getRevealLabel(), Duration.ofMillis(scrape.getRevealSettleMs()));
        PageSnapshot snapshot = session.capture();

        ExtractedContact contact = extractor.extract(snapshot);
        return new ScrapedRecord(
            unitId,
            contact.name(),
            contact.hasEmail() ? contact.email() : null,
            contact.phone(),
            contact.address(),
            contact.foiaOfficerName(),
            url
        );
    }

    /**
     * Waits for one visit. The timeout runs from the moment the task starts on its worker, so
     * time spent queued behind a slow predecessor is not charged to it; the queue wait itself
     * is bounded by the same timeout.
     */
    private ScrapedRecord await(PendingVisit pending, long timeoutMs) {
        String unitId = pending.unitId();
        String url = properties.getScrape().pageUrlFor(unitId);
        Future<ScrapedRecord> result = pending.result();
        try {
            long startedAt;
            try {
                startedAt = pending.startedAt().get(timeoutMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                result.cancel(true);
                log.warn("Scrape of {} did not start within {}s; worker still busy, using placeholder", unitId, timeoutMs / 1000);
                return ScrapedRecord.placeholder(unitId, url);
            }
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
            ScrapedRecord record = result.get(Math.max(0, timeoutMs - elapsedMs), TimeUnit.MILLISECONDS);
            return record == null ? ScrapedRecord.placeholder(unitId, url) : record;
        } catch (TimeoutException e) {
            result.cancel(true);
            log.warn("Scrape of {} timed out after {}s; using placeholder", unitId, timeoutMs / 1000);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Scrape of {} failed: {}", unitId, cause.getMessage());
            log.debug("Scrape failure detail for {}", unitId, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result.cancel(true);
            log.warn("Interrupted while waiting for scrape of {}", unitId);
        }
        return ScrapedRecord.placeholder(unitId, url);
    }

    private record PendingVisit(String unitId, CompletableFuture<Long> startedAt, Future<ScrapedRecord> result) {}
}
