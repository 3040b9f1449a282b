package com.foiarelay.directory.api;

import com.foiarelay.directory.model.PipelineRunSummary;

public record PipelineStatusResponse(
    boolean active,
    PipelineRunSummary latest
) {}
