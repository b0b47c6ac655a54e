package com.newsagent.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsagent.model.Article;
import com.newsagent.model.HeadlineCacheEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Daily cache of top headlines keyed by country and category.
 *
 * <p>The backing {@link HeadlineStore} is chosen once by {@link #create}: a file store when the
 * deployment allows local writes and the cache directory passes a write probe, memory otherwise.
 * A file write that fails later moves the cache to memory for the rest of the process.
 *
 * <p>Entries are only served on the day they were written.
 */
public class HeadlineCache {

    private static final Logger log = LoggerFactory.getLogger(HeadlineCache.class);

    static final String PROBE_FILE = ".write_probe";

    private final Clock clock;
    private volatile HeadlineStore store;

    public HeadlineCache(HeadlineStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static HeadlineCache create(DeploymentMode mode, Path cacheDir, ObjectMapper objectMapper, Clock clock) {
        if (mode == DeploymentMode.SERVICES_RESTRICTED) {
            log.info("Headline cache using memory: local writes are disabled in restricted mode");
            return new HeadlineCache(new InMemoryHeadlineStore(), clock);
        }
        if (probeWritable(cacheDir)) {
            log.info("Headline cache using directory {}", cacheDir.toAbsolutePath());
            return new HeadlineCache(new FileHeadlineStore(cacheDir, objectMapper), clock);
        }
        log.warn("Headline cache using memory: {} is not writable", cacheDir.toAbsolutePath());
        return new HeadlineCache(new InMemoryHeadlineStore(), clock);
    }

    static boolean probeWritable(Path cacheDir) {
        try {
            Files.createDirectories(cacheDir);
            Path probe = cacheDir.resolve(PROBE_FILE);
            Files.writeString(probe, "probe");
            Files.deleteIfExists(probe);
            return true;
        } catch (IOException | SecurityException e) {
            log.warn("Cache directory probe failed for {}: {}", cacheDir, e.getMessage());
            return false;
        }
    }

    public Optional<List<Article>> get(String country, String category) {
        LocalDate today = today();
        HeadlineCacheKey key = HeadlineCacheKey.of(country, category, today);
        Optional<HeadlineCacheEntry> entry = store.read(key)
                .filter(e -> today.toString().equals(e.date()));
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        List<Article> headlines = entry.get().headlines() != null ? entry.get().headlines() : List.of();
        log.info("Retrieved {} headlines from cache", headlines.size());
        return Optional.of(headlines);
    }

    public void put(String country, String category, List<Article> articles) {
        Objects.requireNonNull(articles, "articles");
        LocalDate today = today();
        HeadlineCacheKey key = HeadlineCacheKey.of(country, category, today);
        HeadlineCacheEntry entry = new HeadlineCacheEntry(
                today.toString(),
                LocalDateTime.now(clock).toString(),
                country,
                category,
                List.copyOf(articles));

        HeadlineStore current = store;
        try {
            current.write(key, entry);
        } catch (IOException | UncheckedIOException e) {
            log.warn("Error saving headlines to cache, continuing in memory: {}", e.getMessage());
            InMemoryHeadlineStore memory = new InMemoryHeadlineStore();
            store = memory;
            memory.write(key, entry);
        }
        log.info("Cached {} headlines for {}{}", articles.size(), country,
                category != null && !category.isBlank() ? "/" + category : "");
    }

    /**
     * Drops every entry not dated today.
     *
     * @return number of entries removed
     */
    public int evictStale() {
        return store.evictExcept(today());
    }

    public boolean isDurable() {
        return store.isDurable();
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
