package com.newsagent.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

public record NewsSearchRequest(
    @NotBlank String query,
    @Min(1) @Max(100) Integer limit
) {

    public static final int DEFAULT_LIMIT = 10;

    public int limitOrDefault() {
        return limit != null ? limit : DEFAULT_LIMIT;
    }
}
