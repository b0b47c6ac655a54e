package com.newsagent.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsagent.model.Article;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HeadlineCacheTest {

    private static final LocalDate DAY_ONE = LocalDate.of(2026, 10, 17);
    private static final LocalDate DAY_TWO = LocalDate.of(2026, 10, 18);
    private static final LocalDate DAY_THREE = LocalDate.of(2026, 10, 19);

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MutableClock clock;
    private Path cacheDir;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(DAY_THREE);
        cacheDir = tempDir.resolve("cache");
    }

    @Test
    void create_shouldUseFilesWhenDirectoryIsWritable() {
        HeadlineCache cache = HeadlineCache.create(DeploymentMode.SERVICES_ENABLED, cacheDir, objectMapper, clock);

        assertTrue(cache.isDurable());
        assertTrue(Files.isDirectory(cacheDir));
        assertFalse(Files.exists(cacheDir.resolve(HeadlineCache.PROBE_FILE)));
    }

    @Test
    void create_shouldStayInMemoryInRestrictedModeWithoutTouchingDisk() {
        HeadlineCache cache = HeadlineCache.create(DeploymentMode.SERVICES_RESTRICTED, cacheDir, objectMapper, clock);

        assertFalse(cache.isDurable());
        cache.put("us", "technology", articles("a"));

        assertFalse(Files.exists(cacheDir));
        assertEquals(Optional.of(articles("a")), cache.get("us", "technology"));
    }

    @Test
    void create_shouldFallBackToMemoryWhenProbeFails() throws IOException {
        Files.writeString(cacheDir, "not a directory");

        HeadlineCache cache = HeadlineCache.create(DeploymentMode.SERVICES_ENABLED, cacheDir, objectMapper, clock);

        assertFalse(cache.isDurable());
        cache.put("us", null, articles("a"));
        assertEquals(Optional.of(articles("a")), cache.get("us", null));
    }

    @Test
    void get_shouldReturnMostRecentPutOfTheDay() {
        HeadlineCache cache = HeadlineCache.create(DeploymentMode.SERVICES_ENABLED, cacheDir, objectMapper, clock);

        cache.put("us", "business", articles("first"));
        cache.put("us", "business", articles("second", "third"));

        assertEquals(Optional.of(articles("second", "third")), cache.get("us", "business"));
        assertTrue(Files.exists(cacheDir.resolve("headlines_us_business_2026-10-19.json")));
    }

    @Test
    void get_shouldMissOnTheNextDay() {
        HeadlineCache cache = HeadlineCache.create(DeploymentMode.SERVICES_ENABLED, cacheDir, objectMapper, clock);
        cache.put("us", "business", articles("a"));

        clock.setDay(DAY_THREE.plusDays(1));

        assertEquals(Optional.empty(), cache.get("us", "business"));
    }

    @Test
    void get_shouldMissOnTheNextDayInMemoryToo() {
        HeadlineCache cache = new HeadlineCache(new InMemoryHeadlineStore(), clock);
        cache.put("gb", null, articles("a"));

        clock.setDay(DAY_THREE.plusDays(1));

        assertEquals(Optional.empty(), cache.get("gb", null));
    }

    @Test
    void get_shouldKeepCategoriesApart() {
        HeadlineCache cache = HeadlineCache.create(DeploymentMode.SERVICES_ENABLED, cacheDir, objectMapper, clock);
        cache.put("us", null, articles("all"));
        cache.put("us", "sports", articles("sports"));

        assertEquals(Optional.of(articles("all")), cache.get("us", null));
        assertEquals(Optional.of(articles("sports")), cache.get("us", "sports"));
        assertEquals(Optional.empty(), cache.get("us", "health"));
    }

    @Test
    void get_shouldNotServeUncategorisedHeadlinesForNonLatinCategory() {
        HeadlineCache cache = HeadlineCache.create(DeploymentMode.SERVICES_ENABLED, cacheDir, objectMapper, clock);
        cache.put("us", null, articles("all"));

        assertEquals(Optional.empty(), cache.get("us", "科技"));

        cache.put("us", "科技", articles("tech"));
        assertEquals(Optional.of(articles("tech")), cache.get("us", "科技"));
        assertEquals(Optional.of(articles("all")), cache.get("us", null));
    }

    @Test
    void get_shouldTreatMismatchedDateFieldAsMiss() throws IOException {
        HeadlineCache cache = HeadlineCache.create(DeploymentMode.SERVICES_ENABLED, cacheDir, objectMapper, clock);
        Files.writeString(cacheDir.resolve("headlines_us_2026-10-19.json"), """
                {"date":"2026-10-18","timestamp":"2026-10-18T09:00:00","country":"us","category":null,
                 "headlines":[{"id":"x","title":"Old"}]}
                """);

        assertEquals(Optional.empty(), cache.get("us", null));
    }

    @Test
    void get_shouldTreatMalformedFileAsMiss() throws IOException {
        HeadlineCache cache = HeadlineCache.create(DeploymentMode.SERVICES_ENABLED, cacheDir, objectMapper, clock);
        Files.writeString(cacheDir.resolve("headlines_us_2026-10-19.json"), "{not json");

        assertEquals(Optional.empty(), cache.get("us", null));
    }

    @Test
    void put_shouldWriteDocumentedFileLayout() throws IOException {
        HeadlineCache cache = HeadlineCache.create(DeploymentMode.SERVICES_ENABLED, cacheDir, objectMapper, clock);
        cache.put("us", "science", articles("a"));

        JsonNode root = objectMapper.readTree(cacheDir.resolve("headlines_us_science_2026-10-19.json").toFile());
        assertEquals("2026-10-19", root.path("date").asText());
        assertTrue(root.path("timestamp").asText().startsWith("2026-10-19T"));
        assertEquals("us", root.path("country").asText());
        assertEquals("science", root.path("category").asText());
        assertEquals("a", root.path("headlines").get(0).path("id").asText());
        assertEquals("https://example.com/a", root.path("headlines").get(0).path("url").asText());
    }

    @Test
    void put_shouldSwitchToMemoryWhenDiskWriteFails() throws IOException {
        HeadlineCache cache = HeadlineCache.create(DeploymentMode.SERVICES_ENABLED, cacheDir, objectMapper, clock);
        assertTrue(cache.isDurable());

        // the directory disappears and a plain file takes its place
        Files.delete(cacheDir);
        Files.writeString(cacheDir, "blocked");

        cache.put("us", "business", articles("a"));

        assertFalse(cache.isDurable());
        assertEquals(Optional.of(articles("a")), cache.get("us", "business"));

        cache.put("us", "business", articles("b"));
        assertEquals(Optional.of(articles("b")), cache.get("us", "business"));
    }

    @Test
    void evictStale_shouldKeepOnlyTodaysFile() throws IOException {
        HeadlineCache cache = HeadlineCache.create(DeploymentMode.SERVICES_ENABLED, cacheDir, objectMapper, clock);
        clock.setDay(DAY_ONE);
        cache.put("us", "business", articles("one"));
        clock.setDay(DAY_TWO);
        cache.put("us", "business", articles("two"));
        clock.setDay(DAY_THREE);
        cache.put("us", "business", articles("three"));

        assertEquals(2, cache.evictStale());

        assertEquals(List.of("headlines_us_business_2026-10-19.json"), cacheFiles());
        assertEquals(Optional.of(articles("three")), cache.get("us", "business"));
        assertEquals(0, cache.evictStale());
    }

    @Test
    void evictStale_shouldKeepOnlyTodaysEntryInMemory() {
        InMemoryHeadlineStore store = new InMemoryHeadlineStore();
        HeadlineCache cache = new HeadlineCache(store, clock);
        clock.setDay(DAY_ONE);
        cache.put("us", "business", articles("one"));
        clock.setDay(DAY_TWO);
        cache.put("us", "business", articles("two"));
        clock.setDay(DAY_THREE);
        cache.put("us", "business", articles("three"));

        assertEquals(2, cache.evictStale());

        assertEquals(1, store.size());
        assertEquals(Optional.of(articles("three")), cache.get("us", "business"));
        assertEquals(0, cache.evictStale());
    }

    @Test
    void evictStale_shouldBeSafeWithNothingCached() throws IOException {
        HeadlineCache fileCache = HeadlineCache.create(DeploymentMode.SERVICES_ENABLED, cacheDir, objectMapper, clock);
        HeadlineCache memoryCache = new HeadlineCache(new InMemoryHeadlineStore(), clock);

        assertEquals(0, fileCache.evictStale());
        assertEquals(0, memoryCache.evictStale());

        Files.delete(cacheDir);
        assertEquals(0, fileCache.evictStale());
    }

    @Test
    void evictStale_shouldLeaveUnrelatedFilesAlone() throws IOException {
        HeadlineCache cache = HeadlineCache.create(DeploymentMode.SERVICES_ENABLED, cacheDir, objectMapper, clock);
        Files.writeString(cacheDir.resolve("notes.txt"), "keep me");
        Files.writeString(cacheDir.resolve("headlines_us_2026-10-01.json"), "{}");

        assertEquals(1, cache.evictStale());
        assertTrue(Files.exists(cacheDir.resolve("notes.txt")));
    }

    private List<String> cacheFiles() throws IOException {
        try (Stream<Path> files = Files.list(cacheDir)) {
            return files.map(p -> p.getFileName().toString()).sorted().toList();
        }
    }

    private static List<Article> articles(String... ids) {
        return Stream.of(ids)
                .map(id -> new Article(id, "Title " + id, "https://example.com/" + id, "Summary " + id,
                        "2026-10-19T08:00:00Z", "Example News", "Reporter", null))
                .toList();
    }
}
