package com.newsagent.model;

public record UpsertResult(
    int totalRecords,
    int successful,
    int failed
) {

    public boolean success() {
        return failed == 0;
    }
}
