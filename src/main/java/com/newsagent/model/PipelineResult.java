package com.newsagent.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of ingesting one topic, headline set or domain.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineResult(
    boolean success,
    String target,
    int articlesFetched,
    int articlesProcessed,
    int articlesFailed,
    String error,
    String timestamp
) {

    public static PipelineResult completed(String target, int fetched, int processed, int failed, String timestamp) {
        return new PipelineResult(true, target, fetched, processed, failed, null, timestamp);
    }

    public static PipelineResult failure(String target, String error, String timestamp) {
        return new PipelineResult(false, target, 0, 0, 0, error, timestamp);
    }
}
