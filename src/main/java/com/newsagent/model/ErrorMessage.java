package com.newsagent.model;

public record ErrorMessage(
    String type,
    String message
) {

    public static ErrorMessage of(String message) {
        return new ErrorMessage("error", message);
    }
}
