package com.newsagent.cache;

import com.newsagent.model.HeadlineCacheEntry;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryHeadlineStore implements HeadlineStore {

    private final Map<HeadlineCacheKey, HeadlineCacheEntry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<HeadlineCacheEntry> read(HeadlineCacheKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void write(HeadlineCacheKey key, HeadlineCacheEntry entry) {
        entries.put(key, entry);
    }

    @Override
    public int evictExcept(LocalDate today) {
        int before = entries.size();
        entries.keySet().removeIf(key -> !today.equals(key.date()));
        return before - entries.size();
    }

    @Override
    public boolean isDurable() {
        return false;
    }

    int size() {
        return entries.size();
    }
}
