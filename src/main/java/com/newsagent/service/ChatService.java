package com.newsagent.service;

import com.newsagent.chat.AssembledPrompt;
import com.newsagent.chat.PromptAssembler;
import com.newsagent.exception.VectorStoreException;
import com.newsagent.model.BotResponse;
import com.newsagent.model.UserMessage;
import com.newsagent.model.VectorMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class ChatService {

    private static final Logger log = LoggerFactory.getLogger(ChatService.class);

    private final PineconeService pineconeService;
    private final GeminiService geminiService;
    private final PromptAssembler promptAssembler;
    private final int similarTopK;
    private final int tokenBudget;

    public ChatService(PineconeService pineconeService,
                       GeminiService geminiService,
                       PromptAssembler promptAssembler,
                       @Value("${chat.similar-top-k:20}") int similarTopK,
                       @Value("${chat.token-budget:1000000}") int tokenBudget) {
        this.pineconeService = pineconeService;
        this.geminiService = geminiService;
        this.promptAssembler = promptAssembler;
        this.similarTopK = similarTopK;
        this.tokenBudget = tokenBudget;
    }

    public BotResponse reply(UserMessage message) {
        String selectedArticle = message.selectedNewsArticle();
        List<String> similarArticles = new ArrayList<>();
        if (selectedArticle != null && !selectedArticle.isBlank()) {
            try {
                for (VectorMatch match : pineconeService.searchSimilar(selectedArticle, similarTopK, null)) {
                    similarArticles.add(articleText(match.fields()));
                }
            } catch (VectorStoreException e) {
                // the turn is still answered, just without related articles
                log.warn("Similar article search failed, continuing without it: {}", e.getMessage());
            }
        }

        AssembledPrompt prompt = promptAssembler.assemble(
                message.historyOrEmpty(), selectedArticle, similarArticles, message.content(), tokenBudget);
        if (prompt.droppedArticles() > 0) {
            log.info("Dropped {} similar articles to fit a budget of {} tokens", prompt.droppedArticles(), tokenBudget);
        }
        return BotResponse.of(geminiService.generateResponse(prompt.prompt()));
    }

    /**
     * The stored record text, or title and summary when a record has none.
     */
    static String articleText(Map<String, Object> fields) {
        Object text = fields.get("text");
        if (text != null && !text.toString().isBlank()) {
            return text.toString();
        }
        Object summary = fields.get("summary");
        if (summary == null) {
            summary = fields.get("description");
        }
        return nvl(fields.get("title")) + "\n" + nvl(summary);
    }

    private static String nvl(Object value) {
        return value == null ? "" : value.toString();
    }
}
