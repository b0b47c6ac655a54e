package com.newsagent.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record HeadlinesResponse(
    @JsonProperty("country") String country,
    @JsonProperty("category") String category,
    @JsonProperty("cached") boolean cached,
    @JsonProperty("headlines") List<Article> headlines
) {}
