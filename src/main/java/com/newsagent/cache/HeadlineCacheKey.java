package com.newsagent.cache;

import com.newsagent.util.ArticleIds;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

/**
 * Cache key: country, optional category and calendar day.
 * Country and category are reduced to lowercase alphanumerics so the key is safe as a file name;
 * a value with no such characters is replaced by a short digest of itself.
 */
public record HeadlineCacheKey(String country, String category, LocalDate date) {

    static final String FILE_PREFIX = "headlines_";
    static final String FILE_SUFFIX = ".json";

    private static final int HASHED_LENGTH = 16;

    public static HeadlineCacheKey of(String country, String category, LocalDate date) {
        String normalizedCategory = sanitize(category);
        return new HeadlineCacheKey(
                sanitize(country),
                normalizedCategory.isEmpty() ? null : normalizedCategory,
                date);
    }

    public String fileName() {
        if (category == null) {
            return FILE_PREFIX + country + "_" + date + FILE_SUFFIX;
        }
        return FILE_PREFIX + country + "_" + category + "_" + date + FILE_SUFFIX;
    }

    /**
     * Reads the day back out of a cache file name; the date is always the last segment.
     */
    static Optional<LocalDate> dateOfFileName(String fileName) {
        if (!fileName.startsWith(FILE_PREFIX) || !fileName.endsWith(FILE_SUFFIX)) {
            return Optional.empty();
        }
        String stem = fileName.substring(0, fileName.length() - FILE_SUFFIX.length());
        int lastSeparator = stem.lastIndexOf('_');
        try {
            return Optional.of(LocalDate.parse(stem.substring(lastSeparator + 1)));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static String sanitize(String value) {
        if (value == null || value.isBlank()) return "";
        String reduced = value.replaceAll("[^a-zA-Z0-9]", "").toLowerCase(Locale.ROOT);
        if (!reduced.isEmpty()) {
            return reduced;
        }
        // nothing file-safe is left (e.g. non-Latin text); a digest keeps the value distinct
        return "x" + ArticleIds.sha256Hex(value.trim()).substring(0, HASHED_LENGTH);
    }
}
