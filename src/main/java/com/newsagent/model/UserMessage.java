package com.newsagent.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * A chat turn sent by the client. The client resends the whole history every turn;
 * nothing is stored server side.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserMessage(
    @JsonProperty("type") String type,
    @JsonProperty("content") @NotBlank String content,
    @JsonProperty("chat_history") List<String> chatHistory,
    @JsonProperty("selected_news_article") String selectedNewsArticle
) {

    public List<String> historyOrEmpty() {
        return chatHistory != null ? chatHistory : List.of();
    }
}
