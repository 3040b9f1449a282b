package com.foiarelay.directory.model;

import java.time.Instant;

public record PipelineRunSummary(
    long runId,
    Instant startedAt,
    Instant finishedAt,
    String status,
    int registryCount,
    int scrapedCount,
    int withEmailCount,
    int canonicalCount,
    String notes
) {}
