package com.newsagent.model;

import java.util.Map;

/**
 * A text record for the vector store. The store embeds {@code text} itself.
 */
public record VectorRecord(
    String id,
    String text,
    Map<String, Object> metadata
) {}
