package com.newsagent.model;

public record BotResponse(
    String type,
    String content
) {

    public static BotResponse of(String content) {
        return new BotResponse("bot_response", content);
    }
}
