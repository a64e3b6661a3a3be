package com.movie.night.identity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FingerprintNormalizerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final NormalizerRegistry registry = NormalizerRegistry.withDefaults(new HashingTitleEmbedder());

    private static JsonNode json(String raw) {
        try {
            return MAPPER.readTree(raw);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    @Nested
    @DisplayName("TMDb payloads")
    class TmdbTests {

        @Test
        @DisplayName("Should read id, title, runtime and release year")
        void testFullPayload() {
            MovieFingerprint fp = registry.normalize(MetadataSource.TMDB, json("""
                    {"imdb_id": "tt1049413", "title": "Up", "runtime": 96, "release_date": "2009-05-28"}
                    """));

            assertEquals(MetadataSource.TMDB, fp.source());
            assertEquals("tt1049413", fp.externalId());
            assertEquals("Up", fp.title());
            assertEquals(96, fp.runtimeMinutes());
            assertEquals(2009, fp.releaseYear());
            assertTrue(fp.hasTitleEmbedding());
        }

        @Test
        @DisplayName("Zero runtime and empty release date count as missing")
        void testPlaceholders() {
            MovieFingerprint fp = registry.normalize(MetadataSource.TMDB, json("""
                    {"title": "Up", "runtime": 0, "release_date": "", "imdb_id": null}
                    """));

            assertNull(fp.runtimeMinutes());
            assertNull(fp.releaseYear());
            assertFalse(fp.hasExternalId());
        }
    }

    @Nested
    @DisplayName("OMDb payloads")
    class OmdbTests {

        @Test
        @DisplayName("Should parse runtime strings and take the year from Released")
        void testFullPayload() {
            MovieFingerprint fp = registry.normalize(MetadataSource.OMDB, json("""
                    {"imdbID": "tt1049413", "Title": "Up", "Runtime": "96 min",
                     "Released": "2009-05-29", "Year": "2009"}
                    """));

            assertEquals("tt1049413", fp.externalId());
            assertEquals(96, fp.runtimeMinutes());
            assertEquals(2009, fp.releaseYear());
        }

        @Test
        @DisplayName("Should fall back to Year when Released is N/A")
        void testYearFallback() {
            MovieFingerprint fp = registry.normalize(MetadataSource.OMDB, json("""
                    {"Title": "Up", "Runtime": "N/A", "Released": "N/A", "Year": "2009"}
                    """));

            assertEquals(2009, fp.releaseYear());
            assertNull(fp.runtimeMinutes());
        }
    }

    @Nested
    @DisplayName("IMDb dataset rows")
    class ImdbTests {

        @Test
        @DisplayName("Should treat \\N as missing")
        void testNullMarker() {
            MovieFingerprint fp = registry.normalize(MetadataSource.IMDB, json("""
                    {"tconst": "tt1049413", "primaryTitle": "Up", "runtimeMinutes": "\\\\N", "startYear": "2009"}
                    """));

            assertEquals("tt1049413", fp.externalId());
            assertNull(fp.runtimeMinutes());
            assertEquals(2009, fp.releaseYear());
        }
    }

    @Test
    @DisplayName("A payload without a title has no embedding")
    void testMissingTitle() {
        MovieFingerprint fp = registry.normalize(MetadataSource.TMDB, json("{\"runtime\": 96}"));

        assertNull(fp.title());
        assertFalse(fp.hasTitleEmbedding());
        assertNull(fp.titleEmbedding());
    }

    @Test
    @DisplayName("Fingerprints of the same film from different sources match")
    void testCrossSourceMatch() {
        MovieFingerprint tmdb = registry.normalize(MetadataSource.TMDB, json("""
                {"title": "Up", "runtime": 96, "release_date": "2009-05-28"}
                """));
        MovieFingerprint omdb = registry.normalize(MetadataSource.OMDB, json("""
                {"Title": "Up", "Runtime": "96 min", "Released": "29 May 2009", "Year": "2009"}
                """));

        assertTrue(new IdentityMatcher().sameMovie(tmdb, omdb).isMatch());
    }

    @Test
    @DisplayName("Should reject a source without a normalizer")
    void testUnknownSource() {
        NormalizerRegistry empty = new NormalizerRegistry();
        assertThrows(IllegalArgumentException.class, () -> empty.forSource(MetadataSource.TMDB));
    }
}
