package com.foiarelay.directory.model;

public record PipelineRunRequest(
    Integer limit,
    Integer concurrency,
    Integer pageSize
) {
    public static PipelineRunRequest defaults() {
        return new PipelineRunRequest(null, null, null);
    }
}
