package com.foiarelay.directory.service;

import com.foiarelay.config.DirectoryProperties;
import com.foiarelay.directory.model.CanonicalRecord;
import com.foiarelay.directory.model.PipelineRunRequest;
import com.foiarelay.directory.model.PipelineRunSummary;
import com.foiarelay.directory.model.RegistryRecord;
import com.foiarelay.directory.model.ScrapedRecord;
import com.foiarelay.directory.reconcile.ReconciliationEngine;
import com.foiarelay.directory.registry.RegistryPageFetcher;
import com.foiarelay.directory.scrape.ScraperPool;
import com.foiarelay.directory.store.DirectoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rebuilds the canonical directory end to end: registry enumeration, page scraping,
 * reconciliation, then a wholesale store replacement. Only one run may be active.
 */
@Service
public class DirectoryPipelineService {
    private static final Logger log = LoggerFactory.getLogger(DirectoryPipelineService.class);

    public static final String STATUS_RUNNING = "RUNNING";
    public static final String STATUS_COMPLETED = "COMPLETED";
    public static final String STATUS_NO_UNITS = "NO_UNITS";
    public static final String STATUS_FAILED = "FAILED";

    private final RegistryPageFetcher registryFetcher;
    private final ScraperPool scraperPool;
    private final ReconciliationEngine reconciliationEngine;
    private final DirectoryStore store;
    private final DirectoryProperties properties;
    private final ExecutorService pipelineRunExecutor;
    private final Clock clock;

    private final AtomicBoolean active = new AtomicBoolean(false);
    private final AtomicLong runIds = new AtomicLong();
    private volatile PipelineRunSummary latest;

    public DirectoryPipelineService(
        RegistryPageFetcher registryFetcher,
        ScraperPool scraperPool,
        ReconciliationEngine reconciliationEngine,
        DirectoryStore store,
        DirectoryProperties properties,
        @Qualifier("pipelineRunExecutor") ExecutorService pipelineRunExecutor,
        Clock clock
    ) {
        this.registryFetcher = registryFetcher;
        this.scraperPool = scraperPool;
        this.reconciliationEngine = reconciliationEngine;
        this.store = store;
        this.properties = properties;
        this.pipelineRunExecutor = pipelineRunExecutor;
        this.clock = clock;
    }

    public PipelineRunSummary run(PipelineRunRequest request) {
        acquire();
        long runId = runIds.incrementAndGet();
        try {
            return execute(runId, clock.instant(), request);
        } finally {
            active.set(false);
        }
    }

    public long startAsync(PipelineRunRequest request) {
        acquire();
        long runId = runIds.incrementAndGet();
        Instant startedAt = clock.instant();
        latest = new PipelineRunSummary(runId, startedAt, null, STATUS_RUNNING, 0, 0, 0, 0, "pipeline started");
        try {
            pipelineRunExecutor.submit(() -> {
                try {
                    execute(runId, startedAt, request);
                } finally {
                    active.set(false);
                }
            });
        } catch (RuntimeException e) {
            active.set(false);
            throw e;
        }
        return runId;
    }

    public Optional<PipelineRunSummary> latest() {
        return Optional.ofNullable(latest);
    }

    public boolean isActive() {
        return active.get();
    }

    private void acquire() {
        if (!active.compareAndSet(false, true)) {
            PipelineRunSummary current = latest;
            String message = current != null && STATUS_RUNNING.equals(current.status())
                ? "Active pipeline run in progress (id=" + current.runId() + ", started " + current.startedAt() + ")"
                : "Active pipeline run in progress";
            throw new ActivePipelineRunException(message);
        }
    }

    private PipelineRunSummary execute(long runId, Instant startedAt, PipelineRunRequest request) {
        PipelineRunRequest effective = request == null ? PipelineRunRequest.defaults() : request;
        int pageSize = effective.pageSize() == null
            ? properties.getRegistry().getPageSize()
            : Math.max(1, effective.pageSize());
        int concurrency = effective.concurrency() == null
            ? properties.getScrape().getConcurrency()
            : Math.max(1, effective.concurrency());
        latest = new PipelineRunSummary(runId, startedAt, null, STATUS_RUNNING, 0, 0, 0, 0, "pipeline started");
        log.info("Pipeline run {} started (pageSize={}, concurrency={}, limit={})", runId, pageSize, concurrency, effective.limit());

        PipelineRunSummary summary;
        try {
            List<RegistryRecord> registry = registryFetcher.fetchAll(pageSize);
            List<String> unitIds = unitIds(registry, effective.limit());
            if (unitIds.isEmpty()) {
                log.warn("Pipeline run {}: registry returned no units; directory left untouched", runId);
                summary = new PipelineRunSummary(
                    runId, startedAt, clock.instant(), STATUS_NO_UNITS, registry.size(), 0, 0, 0,
                    "registry returned no units"
                );
            } else {
                List<ScrapedRecord> scraped = scraperPool.scrape(unitIds, concurrency);
                int withEmail = (int) scraped.stream().filter(ScrapedRecord::hasEmail).count();
                List<CanonicalRecord> canonical = reconciliationEngine.reconcile(scraped, registry);
                store.replaceAll(canonical);
                summary = new PipelineRunSummary(
                    runId, startedAt, clock.instant(), STATUS_COMPLETED, registry.size(), scraped.size(),
                    withEmail, canonical.size(), "directory replaced"
                );
            }
        } catch (RuntimeException e) {
            log.error("Pipeline run {} failed; directory left untouched", runId, e);
            summary = new PipelineRunSummary(
                runId, startedAt, clock.instant(), STATUS_FAILED, 0, 0, 0, 0,
                e.getClass().getSimpleName() + ": " + e.getMessage()
            );
        }
        latest = summary;
        log.info(
            "Pipeline run {} finished with status {} in {}s: registry={}, scraped={}, withEmail={}, canonical={}",
            runId,
            summary.status(),
            Duration.between(startedAt, summary.finishedAt()).toSeconds(),
            summary.registryCount(),
            summary.scrapedCount(),
            summary.withEmailCount(),
            summary.canonicalCount()
        );
        return summary;
    }

    private List<String> unitIds(List<RegistryRecord> registry, Integer limit) {
        List<String> ids = registry.stream()
            .map(RegistryRecord::unitId)
            .filter(id -> id != null && !id.isBlank())
            .distinct()
            .toList();
        if (limit != null && limit > 0 && ids.size() > limit) {
            return ids.subList(0, limit);
        }
        return ids;
    }
}
