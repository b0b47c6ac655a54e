package com.newsagent.service;

import com.newsagent.exception.LlmServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Map;

@Service
public class GeminiService {

    private static final Logger log = LoggerFactory.getLogger(GeminiService.class);

    private final RestTemplate restTemplate;
    private final String apiKey;
    private final String model;
    private final String baseUrl;

    public GeminiService(RestTemplate restTemplate,
                         @Value("${gemini.api.key:}") String apiKey,
                         @Value("${gemini.model:gemini-2.5-flash-lite-preview-06-17}") String model,
                         @Value("${gemini.api.base-url:https://generativelanguage.googleapis.com/v1beta}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.apiKey = apiKey;
        this.model = model;
        this.baseUrl = baseUrl;
    }

    public String generateResponse(String prompt) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new LlmServiceException("Gemini API error: API key is not configured");
        }

        Map<String, Object> part = Map.of("text", prompt);
        Map<String, Object> content = Map.of("parts", List.of(part));
        Map<String, Object> requestBody = Map.of("contents", List.of(content));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Map<String, Object>> entity = new HttpEntity<>(requestBody, headers);

        URI uri = UriComponentsBuilder.fromUriString(baseUrl)
                .pathSegment("models", model + ":generateContent")
                .queryParam("key", apiKey)
                .build()
                .encode()
                .toUri();

        try {
            log.debug("Sending prompt of {} chars to {}", prompt.length(), model);
            @SuppressWarnings("rawtypes")
            ResponseEntity<Map> response = restTemplate.postForEntity(uri, entity, Map.class);
            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                throw new LlmServiceException("Gemini API error: " + response.getStatusCode());
            }
            @SuppressWarnings("unchecked")
            String text = extractTextFromResponse(response.getBody());
            if (text == null) {
                throw new LlmServiceException("Gemini API error: response contained no text");
            }
            return text;
        } catch (RestClientException e) {
            throw new LlmServiceException("Gemini API error: " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private String extractTextFromResponse(Map<String, Object> responseBody) {
        List<Map<String, Object>> candidates = (List<Map<String, Object>>) responseBody.get("candidates");
        if (candidates == null || candidates.isEmpty()) {
            return null;
        }
        Map<String, Object> content = (Map<String, Object>) candidates.get(0).get("content");
        if (content == null) {
            return null;
        }
        List<Map<String, Object>> parts = (List<Map<String, Object>>) content.get("parts");
        if (parts == null || parts.isEmpty()) {
            return null;
        }
        StringBuilder text = new StringBuilder();
        for (Map<String, Object> part : parts) {
            Object value = part.get("text");
            if (value != null) {
                text.append(value);
            }
        }
        return text.length() > 0 ? text.toString() : null;
    }
}
