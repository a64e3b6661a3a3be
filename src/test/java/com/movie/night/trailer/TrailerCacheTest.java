package com.movie.night.trailer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TrailerCacheTest {

    private static final TrailerResolution FOUND =
            TrailerResolution.of("https://www.youtube.com/watch?v=ORFWdXl_zJ4", TrailerSource.PROVIDER);

    @Nested
    @DisplayName("NoOpTrailerCache")
    class NoOpTests {

        @Test
        @DisplayName("Should always return empty on get")
        void testGetAlwaysEmpty() {
            NoOpTrailerCache cache = new NoOpTrailerCache();
            cache.put("Up", FOUND);
            assertTrue(cache.get("Up").isEmpty());
            assertEquals(CacheStats.empty(), cache.getStats());
        }
    }

    @Nested
    @DisplayName("CaffeineTrailerCache")
    class CaffeineTests {

        @Test
        @DisplayName("Should cache and retrieve found resolutions by normalized title")
        void testPutAndGet() {
            CaffeineTrailerCache cache = new CaffeineTrailerCache(CacheConfig.defaults());

            cache.put("Up", FOUND);
            Optional<TrailerResolution> cached = cache.get("  up ");

            assertTrue(cached.isPresent());
            assertEquals(FOUND, cached.get());
        }

        @Test
        @DisplayName("Should not cache misses")
        void testMissesNotCached() {
            CaffeineTrailerCache cache = new CaffeineTrailerCache(CacheConfig.defaults());

            cache.put("Up", TrailerResolution.notFound());

            assertTrue(cache.get("Up").isEmpty());
        }

        @Test
        @DisplayName("Should invalidate single entries and everything")
        void testInvalidate() {
            CaffeineTrailerCache cache = new CaffeineTrailerCache(CacheConfig.defaults());
            cache.put("Up", FOUND);
            cache.put("Heat", FOUND);

            cache.invalidate("UP");
            assertTrue(cache.get("Up").isEmpty());
            assertTrue(cache.get("Heat").isPresent());

            cache.invalidateAll();
            assertTrue(cache.get("Heat").isEmpty());
        }

        @Test
        @DisplayName("Should track hits and misses")
        void testStats() {
            CaffeineTrailerCache cache = new CaffeineTrailerCache(CacheConfig.defaults());
            cache.put("Up", FOUND);

            cache.get("Up");
            cache.get("Heat");

            CacheStats stats = cache.getStats();
            assertEquals(1, stats.hitCount());
            assertEquals(1, stats.missCount());
            assertEquals(0.5, stats.hitRate(), 1e-9);
        }
    }

    @Test
    @DisplayName("Config selects the implementation and validates sizes")
    void testConfig() {
        assertInstanceOf(CaffeineTrailerCache.class, CacheConfig.defaults().toCache());
        assertInstanceOf(NoOpTrailerCache.class, CacheConfig.disabled().toCache());
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 10, true));
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, true));
    }

    @Test
    @DisplayName("A resolution without a URL must be NONE")
    void testResolutionValidation() {
        assertThrows(IllegalArgumentException.class, () -> new TrailerResolution(null, TrailerSource.DB, 1.0));
        assertFalse(TrailerResolution.notFound().found());
        assertEquals("none", TrailerResolution.notFound().sourceTag());
    }
}
