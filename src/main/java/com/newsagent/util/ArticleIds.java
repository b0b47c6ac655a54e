package com.newsagent.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stable identifiers: SHA-256 over URL and publish timestamp, or over any key text.
 */
public final class ArticleIds {

    private ArticleIds() {
    }

    public static String digest(String url, String publishedAt) {
        return sha256Hex(nvl(url) + "|" + nvl(publishedAt));
    }

    public static String sha256Hex(String material) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String recordId(String prefix, String url, String publishedAt) {
        return prefix + "_" + digest(url, publishedAt);
    }

    private static String nvl(String value) {
        return value == null ? "" : value;
    }
}
