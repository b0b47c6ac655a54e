package com.newsagent.chat;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * Builds the chat prompt from history, the selected article, similar articles and the new
 * user message. If the estimate exceeds the token budget, similar articles are dropped from
 * the end of the list (least similar first) until it fits or none are left.
 *
 * <p>Inputs are never modified; null entries in either list are skipped.
 */
@Component
public class PromptAssembler {

    public static final int DEFAULT_TOKEN_BUDGET = 1_000_000;

    static final String CHAT_HISTORY_LABEL = "Chat history:\n";
    static final String SELECTED_ARTICLE_LABEL = "Selected article:\n";
    static final String SIMILAR_ARTICLES_LABEL = "Similar articles:\n";
    static final String USER_MESSAGE_LABEL = "User message:\n";

    private static final int CHARS_PER_TOKEN = 4;

    /**
     * Rough token estimate: one token per four characters, rounded down.
     */
    public int estimateTokens(String text) {
        if (text == null) return 0;
        return text.codePointCount(0, text.length()) / CHARS_PER_TOKEN;
    }

    public AssembledPrompt assemble(List<String> chatHistory,
                                    String selectedArticle,
                                    List<String> similarArticles,
                                    String userMessage) {
        return assemble(chatHistory, selectedArticle, similarArticles, userMessage, DEFAULT_TOKEN_BUDGET);
    }

    public AssembledPrompt assemble(List<String> chatHistory,
                                    String selectedArticle,
                                    List<String> similarArticles,
                                    String userMessage,
                                    int tokenBudget) {
        List<String> history = withoutNulls(chatHistory);
        List<String> candidates = withoutNulls(similarArticles);

        int kept = candidates.size();
        String prompt = build(history, selectedArticle, candidates.subList(0, kept), userMessage);
        while (estimateTokens(prompt) > tokenBudget && kept > 0) {
            kept--;
            prompt = build(history, selectedArticle, candidates.subList(0, kept), userMessage);
        }
        return new AssembledPrompt(
                prompt,
                List.copyOf(candidates.subList(0, kept)),
                candidates.size() - kept,
                estimateTokens(prompt));
    }

    private static List<String> withoutNulls(List<String> values) {
        if (values == null) return List.of();
        return values.stream().filter(Objects::nonNull).toList();
    }

    private String build(List<String> history, String selectedArticle, List<String> similar, String userMessage) {
        StringBuilder prompt = new StringBuilder();
        if (!history.isEmpty()) {
            prompt.append(CHAT_HISTORY_LABEL).append(String.join("\n", history)).append('\n');
        }
        if (selectedArticle != null && !selectedArticle.isEmpty()) {
            prompt.append(SELECTED_ARTICLE_LABEL).append(selectedArticle).append('\n');
        }
        if (!similar.isEmpty()) {
            prompt.append(SIMILAR_ARTICLES_LABEL).append(String.join("\n", similar)).append('\n');
        }
        if (userMessage != null && !userMessage.isEmpty()) {
            prompt.append(USER_MESSAGE_LABEL).append(userMessage).append('\n');
        }
        return prompt.toString();
    }
}
