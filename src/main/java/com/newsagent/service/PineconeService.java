package com.newsagent.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsagent.exception.VectorStoreException;
import com.newsagent.model.UpsertResult;
import com.newsagent.model.VectorMatch;
import com.newsagent.model.VectorRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Pinecone data-plane client for an index with integrated embedding:
 * records are upserted as text and searched by text.
 */
@Service
public class PineconeService {

    private static final Logger log = LoggerFactory.getLogger(PineconeService.class);

    // Pinecone limit on records per upsert request
    static final int BATCH_SIZE_LIMIT = 96;
    static final String API_VERSION = "2025-01";
    static final String DEFAULT_NAMESPACE = "__default__";
    static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String baseUrl;
    private final String namespace;

    public PineconeService(RestTemplate restTemplate,
                           ObjectMapper objectMapper,
                           @Value("${pinecone.api.key:}") String apiKey,
                           @Value("${pinecone.host:}") String host,
                           @Value("${pinecone.namespace:}") String namespace) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.baseUrl = normalizeHost(host);
        this.namespace = namespace == null || namespace.isBlank() ? DEFAULT_NAMESPACE : namespace;
    }

    public List<VectorMatch> searchSimilar(String queryText, int topK, Map<String, Object> filter) {
        Map<String, Object> query = new LinkedHashMap<>();
        query.put("inputs", Map.of("text", queryText));
        query.put("top_k", topK);
        if (filter != null && !filter.isEmpty()) {
            query.put("filter", filter);
        }
        URI uri = uri("/records/namespaces/{namespace}/search", namespace);
        JsonNode root = readTree(send(uri, HttpMethod.POST, Map.of("query", query), MediaType.APPLICATION_JSON),
                "search");

        List<VectorMatch> matches = new ArrayList<>();
        for (JsonNode hit : root.path("result").path("hits")) {
            Map<String, Object> fields = hit.hasNonNull("fields")
                    ? objectMapper.convertValue(hit.get("fields"), MAP_TYPE)
                    : Map.of();
            matches.add(new VectorMatch(hit.path("_id").asText(), hit.path("_score").asDouble(), fields));
        }
        log.info("Found {} similar texts", matches.size());
        return matches;
    }

    public String upsertRecord(String recordId, String text, Map<String, Object> metadata) {
        String id = recordId != null ? recordId : UUID.randomUUID().toString();
        String body = toNdjson(List.of(new VectorRecord(id, text, metadata)));
        send(uri("/records/namespaces/{namespace}/upsert", namespace), HttpMethod.POST, body, NDJSON);
        log.info("Successfully upserted text with ID: {}", id);
        return id;
    }

    /**
     * Upserts records in chunks of {@value #BATCH_SIZE_LIMIT}. A failing chunk is counted as
     * failed and the remaining chunks are still sent.
     */
    public UpsertResult upsertRecords(List<VectorRecord> records) {
        if (records == null || records.isEmpty()) {
            throw new IllegalArgumentException("No records provided");
        }
        URI uri = uri("/records/namespaces/{namespace}/upsert", namespace);
        int successful = 0;
        int failed = 0;
        for (int start = 0; start < records.size(); start += BATCH_SIZE_LIMIT) {
            List<VectorRecord> chunk = records.subList(start, Math.min(start + BATCH_SIZE_LIMIT, records.size()));
            int chunkNumber = start / BATCH_SIZE_LIMIT + 1;
            try {
                send(uri, HttpMethod.POST, toNdjson(chunk), NDJSON);
                successful += chunk.size();
                log.info("Successfully upserted chunk {}: {} texts", chunkNumber, chunk.size());
            } catch (VectorStoreException e) {
                failed += chunk.size();
                log.error("Error upserting chunk {}: {}", chunkNumber, e.getMessage());
            }
        }
        log.info("Batch upsert completed: {} successful, {} failed", successful, failed);
        return new UpsertResult(records.size(), successful, failed);
    }

    public void deleteRecord(String recordId) {
        Map<String, Object> body = Map.of("ids", List.of(recordId), "namespace", namespace);
        send(uri("/vectors/delete"), HttpMethod.POST, body, MediaType.APPLICATION_JSON);
        log.info("Successfully deleted record with ID: {}", recordId);
    }

    public Map<String, Object> fetchRecords(List<String> recordIds) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(requireBaseUrl()).path("/vectors/fetch");
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < recordIds.size(); i++) {
            builder.queryParam("ids", "{id" + i + "}");
            values.put("id" + i, recordIds.get(i));
        }
        builder.queryParam("namespace", "{namespace}");
        values.put("namespace", namespace);
        URI uri = builder.encode().buildAndExpand(values).toUri();
        JsonNode root = readTree(send(uri, HttpMethod.GET, null, null), "fetch");
        return root.hasNonNull("vectors") ? objectMapper.convertValue(root.get("vectors"), MAP_TYPE) : Map.of();
    }

    public Map<String, Object> describeIndexStats() {
        JsonNode root = readTree(send(uri("/describe_index_stats"), HttpMethod.POST, Map.of(), MediaType.APPLICATION_JSON),
                "describe_index_stats");
        return objectMapper.convertValue(root, MAP_TYPE);
    }

    private String toNdjson(List<VectorRecord> records) {
        StringBuilder body = new StringBuilder();
        for (VectorRecord record : records) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("_id", record.id());
            row.put("text", record.text());
            if (record.metadata() != null) {
                row.putAll(record.metadata());
            }
            row.put("text_length", record.text() != null ? record.text().length() : 0);
            try {
                body.append(objectMapper.writeValueAsString(row)).append('\n');
            } catch (JsonProcessingException e) {
                throw new VectorStoreException("Could not serialize record " + record.id(), e);
            }
        }
        return body.toString();
    }

    private String send(URI uri, HttpMethod method, Object body, MediaType contentType) {
        HttpHeaders headers = new HttpHeaders();
        headers.set("Api-Key", requireApiKey());
        headers.set("X-Pinecone-API-Version", API_VERSION);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (contentType != null) {
            headers.setContentType(contentType);
        }
        try {
            return restTemplate.exchange(uri, method, new HttpEntity<>(body, headers), String.class).getBody();
        } catch (RestClientException e) {
            throw new VectorStoreException("Pinecone request to " + uri.getPath() + " failed: " + e.getMessage(), e);
        }
    }

    private JsonNode readTree(String body, String operation) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new VectorStoreException("Unreadable Pinecone " + operation + " response", e);
        }
    }

    private URI uri(String path, Object... variables) {
        return UriComponentsBuilder.fromUriString(requireBaseUrl())
                .path(path)
                .buildAndExpand(variables)
                .encode()
                .toUri();
    }

    private String requireBaseUrl() {
        if (baseUrl == null) {
            throw new VectorStoreException("Missing Pinecone configuration: pinecone.host is not set");
        }
        return baseUrl;
    }

    private String requireApiKey() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new VectorStoreException("Missing Pinecone configuration: pinecone.api.key is not set");
        }
        return apiKey;
    }

    static String normalizeHost(String host) {
        if (host == null || host.isBlank()) {
            return null;
        }
        String trimmed = host.trim();
        if (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.startsWith("http://") || trimmed.startsWith("https://") ? trimmed : "https://" + trimmed;
    }
}
