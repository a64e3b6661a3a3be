package com.movie.night.config;

import com.movie.night.model.RatingSources;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MovieNightConfig Tests")
class MovieNightConfigTest {

    private static Config config(String... keyValues) {
        Map<String, String> values = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            values.put(keyValues[i], keyValues[i + 1]);
        }
        return new SmallRyeConfigBuilder()
                .withSources(new PropertiesConfigSource(values, "test", 500))
                .build();
    }

    @Nested
    @DisplayName("Defaults")
    class DefaultTests {

        @Test
        @DisplayName("An empty config gives the defaults")
        void testEmptyConfig() {
            MovieNightConfig config = MovieNightConfig.fromConfig(config());

            assertEquals(0.80, config.getMatchOptions().getThreshold(), 1e-9);
            assertEquals(10, config.getMatchOptions().getRuntimeToleranceMinutes());
            assertEquals(1, config.getMatchOptions().getYearTolerance());
            assertTrue(config.getResolverOptions().isFuzzyLocalLookup());
            assertEquals(3, config.getResolverOptions().getSecondaryMaxRetries());
            assertEquals(2_000, config.getTrailerCache().maxSize());
            assertTrue(config.getTrailerCache().enabled());
            assertEquals(Duration.ofMillis(400), config.getProviderThrottle().minInterval());
            assertEquals(Duration.ofMillis(1200), config.getTrendThrottle().minInterval());
            assertEquals(Duration.ofMillis(1000), config.getVideoThrottle().minInterval());
            assertEquals(1.5, config.getScoringOptions().penalty(RatingSources.IMDB), 1e-9);
            assertTrue(config.getCredentials().metadataProvider().isEmpty());
        }

        @Test
        @DisplayName("The bundled microprofile-config.properties matches the defaults")
        void testClasspathResource() {
            MovieNightConfig config = MovieNightConfig.fromClasspath();

            assertEquals(0.80, config.getMatchOptions().getThreshold(), 1e-9);
            assertEquals(1.2, config.getScoringOptions().penalty(RatingSources.METACRITIC), 1e-9);
            assertEquals(Duration.ofMillis(600), config.getSecondaryThrottle().minInterval());
        }
    }

    @Nested
    @DisplayName("Overrides")
    class OverrideTests {

        @Test
        @DisplayName("Reads every section")
        void testOverrides() {
            MovieNightConfig config = MovieNightConfig.fromConfig(config(
                    "movie-night.identity.threshold", "0.9",
                    "movie-night.identity.year-tolerance", "0",
                    "movie-night.trailer.fuzzy-local-lookup", "off",
                    "movie-night.trailer.fuzzy-cutoff", "0.75",
                    "movie-night.cache.max-size", "50",
                    "movie-night.cache.enabled", "no",
                    "movie-night.throttle.jitter-ms", "0",
                    "movie-night.throttle.provider-interval-ms", "250",
                    "movie-night.scoring.bonus-scale", "2.5",
                    "movie-night.scoring.penalty.tmdb", "2.0",
                    "movie-night.credentials.metadata-provider-key", "abc123"));

            assertEquals(0.9, config.getMatchOptions().getThreshold(), 1e-9);
            assertEquals(0, config.getMatchOptions().getYearTolerance());
            assertFalse(config.getResolverOptions().isFuzzyLocalLookup());
            assertEquals(0.75, config.getResolverOptions().getFuzzyCutoff(), 1e-9);
            assertEquals(50, config.getTrailerCache().maxSize());
            assertFalse(config.getTrailerCache().enabled());
            assertEquals(Duration.ofMillis(250), config.getProviderThrottle().minInterval());
            assertEquals(Duration.ZERO, config.getProviderThrottle().maxJitter());
            assertEquals(2.5, config.getScoringOptions().getBonusScale(), 1e-9);
            assertEquals(2.0, config.getScoringOptions().penalty(RatingSources.TMDB), 1e-9);
            assertEquals("abc123", config.getCredentials().metadataProvider().orElseThrow());
        }

        @Test
        @DisplayName("Disabling throttling disables every service")
        void testThrottleDisabled() {
            MovieNightConfig config = MovieNightConfig.fromConfig(config(
                    "movie-night.throttle.enabled", "false"));

            assertFalse(config.getProviderThrottle().enabled());
            assertFalse(config.getSecondaryThrottle().enabled());
            assertFalse(config.getTrendThrottle().enabled());
            assertFalse(config.getVideoThrottle().enabled());
            assertDoesNotThrow(() -> config.rateLimiter().acquire("provider"));
        }

        @Test
        @DisplayName("The builder can switch pacing off")
        void testNoThrottling() {
            MovieNightConfig config = MovieNightConfig.builder().noThrottling().build();

            assertFalse(config.getVideoThrottle().enabled());
            assertNotNull(config.rateLimiter());
        }
    }

    @Nested
    @DisplayName("Invalid values")
    class InvalidTests {

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {
                "movie-night.cache.max-size=lots",
                "movie-night.identity.threshold=high",
                "movie-night.identity.threshold=1.5",
                "movie-night.cache.ttl-seconds=0",
                "movie-night.scoring.penalty.IMDB=-1"
        })
        @DisplayName("Raise a configuration error")
        void testInvalid(String entry) {
            String[] parts = entry.split("=", 2);
            Config source = config(parts[0], parts[1]);

            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> MovieNightConfig.fromConfig(source));
            assertNotNull(e.getMessage());
        }

        @Test
        @DisplayName("Names the offending key")
        void testMessageNamesKey() {
            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> MovieNightConfig.fromConfig(config("movie-night.throttle.jitter-ms", "1.5")));

            assertTrue(e.getMessage().contains("movie-night.throttle.jitter-ms"));
        }

        @Test
        @DisplayName("Blank credentials count as absent")
        void testBlankCredentials() {
            MovieNightConfig config = MovieNightConfig.fromConfig(config(
                    "movie-night.credentials.video-search-key", ""));

            assertTrue(config.getCredentials().videoSearch().isEmpty());
        }
    }
}
