package com.newsagent.util;

import org.jsoup.Jsoup;

import java.util.regex.Pattern;

/**
 * Text clean-up for NewsAPI fields before they are embedded.
 */
public final class ArticleText {

    // NewsAPI cuts "content" and appends e.g. "… [+2315 chars]"
    private static final Pattern TRUNCATION_MARKER = Pattern.compile("\\s*…?\\s*\\[\\+\\d+ chars]\\s*$");

    private ArticleText() {
    }

    public static String clean(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        String text = Jsoup.parse(html).text();
        return TRUNCATION_MARKER.matcher(text).replaceFirst("").trim();
    }

    public static String truncate(String text, int maxChars) {
        if (text == null) return "";
        return text.length() > maxChars ? text.substring(0, maxChars) : text;
    }
}
