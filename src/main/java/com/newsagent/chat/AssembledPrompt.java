package com.newsagent.chat;

import java.util.List;

/**
 * @param prompt           the text sent to the model
 * @param similarArticles  the similar articles that survived trimming, most similar first
 * @param droppedArticles  how many similar articles were trimmed away
 * @param estimatedTokens  estimate for {@code prompt}
 */
public record AssembledPrompt(
    String prompt,
    List<String> similarArticles,
    int droppedArticles,
    int estimatedTokens
) {}
