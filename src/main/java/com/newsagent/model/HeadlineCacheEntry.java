package com.newsagent.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One day's worth of cached headlines for a country and optional category.
 * {@code date} is an ISO calendar day; the entry is only valid on that day.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HeadlineCacheEntry(
    @JsonProperty("date") String date,
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("country") String country,
    @JsonProperty("category") String category,
    @JsonProperty("headlines") List<Article> headlines
) {}
