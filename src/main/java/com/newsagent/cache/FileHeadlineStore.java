package com.newsagent.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsagent.model.HeadlineCacheEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.util.Optional;

/**
 * One JSON file per country, category and day under a cache directory.
 * Writes go through a temp file in the same directory and an atomic rename.
 */
public class FileHeadlineStore implements HeadlineStore {

    private static final Logger log = LoggerFactory.getLogger(FileHeadlineStore.class);

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileHeadlineStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<HeadlineCacheEntry> read(HeadlineCacheKey key) {
        Path file = directory.resolve(key.fileName());
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(file.toFile(), HeadlineCacheEntry.class));
        } catch (IOException e) {
            log.error("Error reading cache file {}: {}", file.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void write(HeadlineCacheKey key, HeadlineCacheEntry entry) throws IOException {
        Path target = directory.resolve(key.fileName());
        Path temp = Files.createTempFile(directory, key.fileName(), ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), entry);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @Override
    public int evictExcept(LocalDate today) {
        int removed = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory,
                HeadlineCacheKey.FILE_PREFIX + "*" + HeadlineCacheKey.FILE_SUFFIX)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                boolean current = HeadlineCacheKey.dateOfFileName(name)
                        .map(today::equals)
                        .orElse(false);
                if (current) {
                    continue;
                }
                try {
                    Files.deleteIfExists(file);
                    removed++;
                    log.info("Removed old cache file: {}", name);
                } catch (IOException e) {
                    log.error("Error removing cache file {}: {}", name, e.getMessage());
                }
            }
        } catch (NoSuchFileException e) {
            log.debug("Cache directory {} does not exist, nothing to evict", directory);
        } catch (IOException e) {
            log.error("Error clearing old cache: {}", e.getMessage());
        }
        return removed;
    }

    @Override
    public boolean isDurable() {
        return true;
    }
}
