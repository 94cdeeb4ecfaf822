package de.entwicklertraining.capi.cache;

import de.entwicklertraining.capi.TestClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CacheManagerTest {

    private TestClock clock;
    private CacheManager manager;

    @BeforeEach
    void setUp() {
        clock = new TestClock();
        manager = new CacheManager(new MemoryCache(100, clock), CacheOptions.defaults(), clock);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void testCacheKeyFormat() {
        assertEquals("GET:/v3/apps", CacheManager.cacheKey("GET", "/v3/apps", Map.of()));
        assertEquals("GET:/v3/apps:order_by=name&page=1",
                CacheManager.cacheKey("get", "/v3/apps", Map.of("page", "1", "order_by", "name")));
    }

    @Test
    void testStatsAndHitRate() {
        manager.set("key1", bytes("value1"), Duration.ofMinutes(1));
        manager.set("key2", bytes("value2"), Duration.ofMinutes(1));

        assertTrue(manager.get("key1").isPresent());
        assertTrue(manager.get("key2").isPresent());
        assertTrue(manager.get("key1").isPresent());
        assertTrue(manager.get("missing").isEmpty());

        CacheStats stats = manager.getStats();
        assertEquals(3, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(2, stats.sets());
        assertEquals(0.75, stats.hitRate(), 0.0001);
    }

    @Test
    void testHitRateWithoutLookups() {
        assertEquals(0.0, manager.getStats().hitRate());
    }

    @Test
    void testDefaultTtlForNonPositiveValues() {
        manager.set("key", bytes("v"), Duration.ZERO);

        clock.advance(Duration.ofMinutes(4));
        assertTrue(manager.get("key").isPresent());

        clock.advance(Duration.ofMinutes(2));
        assertTrue(manager.get("key").isEmpty());
        assertFalse(manager.trackedKeys().contains("key"));
    }

    @Test
    void testETagLookupDoesNotCountStats() {
        manager.setWithETag("key", bytes("v"), "\"abc\"", Duration.ofMinutes(1));

        assertEquals("\"abc\"", manager.getETag("key").orElseThrow());
        assertEquals(0, manager.getStats().hits());
        assertEquals(0, manager.getStats().misses());
    }

    @Test
    void testETagsCanBeDisabled() {
        CacheManager noTags = new CacheManager(null, new CacheOptions(Duration.ofMinutes(1), 10, false), clock);
        noTags.setWithETag("key", bytes("v"), "\"abc\"", null);

        assertTrue(noTags.getETag("key").isEmpty());
        assertTrue(noTags.get("key").isPresent());
    }

    @Test
    void testRefreshExtendsLifetime() {
        manager.set("key", bytes("v"), Duration.ofSeconds(10));
        clock.advance(Duration.ofSeconds(8));

        assertTrue(manager.refresh("key", Duration.ofSeconds(10)).isPresent());
        clock.advance(Duration.ofSeconds(8));

        assertTrue(manager.get("key").isPresent());
        assertTrue(manager.refresh("other", Duration.ofSeconds(10)).isEmpty());
    }

    @Test
    void testInvalidateRelated() {
        manager.set(CacheManager.cacheKey("GET", "/v3/apps", Map.of()), bytes("list"), null);
        manager.set(CacheManager.cacheKey("GET", "/v3/apps", Map.of("page", "2")), bytes("page2"), null);
        manager.set(CacheManager.cacheKey("GET", "/v3/apps/a1", Map.of()), bytes("app"), null);
        manager.set(CacheManager.cacheKey("GET", "/v3/apps/a1/env", Map.of()), bytes("env"), null);
        manager.set(CacheManager.cacheKey("GET", "/v3/apps/a2", Map.of()), bytes("other"), null);
        manager.set(CacheManager.cacheKey("GET", "/v3/spaces", Map.of()), bytes("spaces"), null);

        int removed = manager.invalidateRelated("/v3/apps/a1");

        assertEquals(4, removed);
        assertTrue(manager.get("GET:/v3/apps/a2").isPresent());
        assertTrue(manager.get("GET:/v3/spaces").isPresent());
        assertTrue(manager.get("GET:/v3/apps").isEmpty());
        assertTrue(manager.get("GET:/v3/apps/a1/env").isEmpty());
    }

    @Test
    void testDeleteAndClear() {
        manager.set("a", bytes("1"), null);
        manager.set("b", bytes("2"), null);

        manager.delete("a");
        assertEquals(1, manager.trackedKeys().size());

        manager.clear();
        assertTrue(manager.trackedKeys().isEmpty());
        assertTrue(manager.get("b").isEmpty());
    }

    @Test
    void testDisabledCacheAlwaysMisses() {
        CacheManager disabled = new CacheManager(new NoOpCache());
        disabled.set("key", bytes("v"), null);

        disabled.setWithETag("tagged", bytes("v"), "\"e1\"", null);

        assertTrue(disabled.get("key").isEmpty());
        assertEquals(1, disabled.getStats().misses());
        assertTrue(disabled.getETag("tagged").isEmpty());
        assertTrue(disabled.getForRevalidation("tagged").isEmpty());
    }

    @Test
    void testKeyIndexStaysBoundedWhenBackendEvicts() {
        MemoryCache backend = new MemoryCache(2, clock);
        CacheManager small = new CacheManager(backend, CacheOptions.defaults(), clock);

        for (int i = 0; i < 10_000; i++) {
            small.set("key" + i, bytes("v"), null);
        }

        assertEquals(2, backend.size());
        assertTrue(small.trackedKeys().size() <= 4, "tracked " + small.trackedKeys().size());
        assertTrue(small.trackedKeys().contains("key9999"));
    }

    @Test
    void testKeyIndexDropsKeysPurgedByCleanup() {
        MemoryCache backend = new MemoryCache(3, clock);
        CacheManager small = new CacheManager(backend, CacheOptions.defaults(), clock);
        small.set("old1", bytes("v"), Duration.ofSeconds(1));
        small.set("old2", bytes("v"), Duration.ofSeconds(1));
        small.set("old3", bytes("v"), Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(2));
        assertEquals(3, backend.cleanup());

        for (int i = 0; i < 4; i++) {
            small.set("new" + i, bytes("v"), Duration.ofMinutes(1));
        }

        assertFalse(small.trackedKeys().contains("old1"));
        assertTrue(small.trackedKeys().size() <= 6);
    }

    @Test
    void testETagOutlivesExpiredEntry() {
        manager.setWithETag("GET:/v3/apps/a1", bytes("{\"guid\":\"a1\"}"), "\"v1\"", Duration.ofSeconds(10));
        clock.advance(Duration.ofSeconds(20));

        assertTrue(manager.get("GET:/v3/apps/a1").isEmpty());
        assertEquals("\"v1\"", manager.getETag("GET:/v3/apps/a1").orElseThrow());
        CacheEntry stale = manager.getForRevalidation("GET:/v3/apps/a1").orElseThrow();
        assertEquals("{\"guid\":\"a1\"}", new String(stale.data(), StandardCharsets.UTF_8));

        assertEquals(1, manager.invalidateRelated("/v3/apps/a1"));
        assertTrue(manager.getETag("GET:/v3/apps/a1").isEmpty());
        assertTrue(manager.getForRevalidation("GET:/v3/apps/a1").isEmpty());
    }

    @Test
    void testEntryWithoutETagLeavesNoValidator() {
        manager.setWithETag("key", bytes("v1"), "\"e1\"", Duration.ofSeconds(10));
        manager.set("key", bytes("v2"), Duration.ofSeconds(10));
        clock.advance(Duration.ofSeconds(20));

        assertTrue(manager.getETag("key").isEmpty());
    }

    @Test
    void testCacheKeyIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals("OPTIONS:/v3/info", CacheManager.cacheKey("options", "/v3/info", Map.of()));
            assertTrue(CachingPolicy.builder().build().shouldCache("get", "/v3/info", 200));
        } finally {
            Locale.setDefault(previous);
        }
    }
}
