package com.newsagent.cache;

import com.newsagent.model.HeadlineCacheEntry;

import java.io.IOException;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Physical storage behind {@link HeadlineCache}.
 */
public interface HeadlineStore {

    /**
     * @return the stored entry, or empty when missing or unreadable
     */
    Optional<HeadlineCacheEntry> read(HeadlineCacheKey key);

    /**
     * Replaces whatever is stored under the key.
     */
    void write(HeadlineCacheKey key, HeadlineCacheEntry entry) throws IOException;

    /**
     * Removes every entry whose key date differs from {@code today}.
     *
     * @return number of entries removed
     */
    int evictExcept(LocalDate today);

    boolean isDurable();
}
