package com.foiarelay.directory.api;

public record PipelineStartResponse(
    long runId,
    String status
) {}
