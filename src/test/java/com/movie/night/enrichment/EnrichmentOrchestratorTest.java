package com.movie.night.enrichment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.movie.night.client.ActorPopularityClient;
import com.movie.night.client.DetailScraper;
import com.movie.night.client.MetadataProviderClient;
import com.movie.night.client.ProviderException;
import com.movie.night.client.ProviderMetadata;
import com.movie.night.client.RateLimitExceededException;
import com.movie.night.client.ScrapedDetails;
import com.movie.night.client.SecondaryMetadataClient;
import com.movie.night.client.TrendClient;
import com.movie.night.client.VideoSearchClient;
import com.movie.night.metrics.MetricsService;
import com.movie.night.model.Movie;
import com.movie.night.model.MovieField;
import com.movie.night.model.RatingHistogram;
import com.movie.night.model.RatingSample;
import com.movie.night.model.RatingSources;
import com.movie.night.scoring.Baselines;
import com.movie.night.scoring.FairnessScoringEngine;
import com.movie.night.store.InMemoryMovieStore;
import com.movie.night.store.MovieNotFoundException;
import com.movie.night.throttle.NoOpRateLimiter;
import com.movie.night.throttle.RateLimiter;
import com.movie.night.trailer.TrailerResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("EnrichmentOrchestrator Tests")
class EnrichmentOrchestratorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String TRAILER = "https://www.youtube.com/watch?v=ORFWdXl_zJ4";

    private InMemoryMovieStore store;
    private MetadataProviderClient provider;
    private SecondaryMetadataClient secondary;
    private DetailScraper scraper;
    private VideoSearchClient videoSearch;
    private TrendClient trendClient;
    private ActorPopularityClient actorClient;
    private RateLimiter rateLimiter;
    private MetricsService metrics;
    private long upId;

    @BeforeEach
    void setUp() {
        store = new InMemoryMovieStore();
        provider = mock(MetadataProviderClient.class);
        secondary = mock(SecondaryMetadataClient.class);
        scraper = mock(DetailScraper.class);
        videoSearch = mock(VideoSearchClient.class);
        trendClient = mock(TrendClient.class);
        actorClient = mock(ActorPopularityClient.class);
        rateLimiter = mock(RateLimiter.class);
        metrics = mock(MetricsService.class);
        upId = store.addMovie(Movie.builder().title("Up"));
    }

    private EnrichmentOrchestrator orchestrator(DetailScraper detailScraper) {
        FairnessScoringEngine engine = new FairnessScoringEngine(Baselines.empty());
        ScoreUpdater scoreUpdater = new ScoreUpdater(store, engine, trendClient, actorClient,
                new NoOpRateLimiter(), metrics);
        return EnrichmentOrchestrator.builder()
                .store(store)
                .provider(provider)
                .secondary(secondary)
                .scraper(detailScraper)
                .trailerResolver(new TrailerResolver(store, provider, videoSearch))
                .scoreUpdater(scoreUpdater)
                .rateLimiter(rateLimiter)
                .metricsService(metrics)
                .build();
    }

    private static JsonNode json(String raw) {
        try {
            return MAPPER.readTree(raw);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static ProviderMetadata.Builder fullMetadata() {
        return ProviderMetadata.builder()
                .title("Up")
                .year(2009)
                .releaseWindow("memorial_lead")
                .ratingCertification("PG")
                .durationSeconds(5760)
                .trailerUrl(TRAILER)
                .originCountry("US")
                .boxOfficeActual(735_099_082L)
                .franchise("Pixar Shorts")
                .externalId("tt1049413")
                .providerId(14160L)
                .genres(List.of("Animation", "Family"))
                .rawPayload(json("""
                        {"title": "Up", "runtime": 96, "release_date": "2009-05-28", "imdb_id": "tt1049413"}
                        """));
    }

    private static JsonNode omdbPayload(String runtime, String year, String plot) {
        return json("""
                {"Title": "Up", "Runtime": "%s", "Year": "%s", "Released": "N/A", "Plot": "%s"}
                """.formatted(runtime, year, plot));
    }

    @Nested
    @DisplayName("Full pass")
    class FullPassTests {

        @Test
        @DisplayName("Fills every source in order and computes the combined score")
        void testFullEnrichment() {
            when(provider.fetchMetadata("Up")).thenReturn(Optional.of(fullMetadata().build()));
            when(secondary.fetchById("tt1049413"))
                    .thenReturn(Optional.of(omdbPayload("96 min", "2009", "An old man flies his house.")));
            when(scraper.fetchAll("tt1049413"))
                    .thenReturn(Optional.of(new ScrapedDetails(8.3, 1_100_000, null)));
            when(trendClient.fetch7DayAverage("Up")).thenReturn(OptionalInt.of(7));
            when(actorClient.fetchPopularity("Up")).thenReturn(OptionalDouble.of(50.0));

            EnrichmentReport report = orchestrator(scraper).enrichMovie(upId);

            assertTrue(report.isSuccessful());
            assertEquals(List.of(
                    MovieField.YEAR, MovieField.ORIGIN_COUNTRY, MovieField.FRANCHISE,
                    MovieField.EXTERNAL_ID, MovieField.PROVIDER_ID, MovieField.RELEASE_WINDOW,
                    MovieField.RATING_CERTIFICATION, MovieField.DURATION_SECONDS,
                    MovieField.BOX_OFFICE_ACTUAL, MovieField.TRAILER_URL, MovieField.PLOT,
                    MovieField.GOOGLE_TREND_SCORE,
                    MovieField.ACTOR_TREND_SCORE), report.filledFields());
            assertEquals(83.0, report.combinedScore(), 1e-9);

            Movie movie = store.findById(upId).orElseThrow();
            assertEquals(2009, movie.getYear());
            assertEquals("An old man flies his house.", movie.getPlot());
            assertEquals(20.0, movie.getGoogleTrendScore(), 1e-9);
            // 0.3 * 50 + 0.7 * 20
            assertEquals(29.0, movie.getActorTrendScore(), 1e-9);
            assertEquals(83.0, movie.getCombinedScore(), 1e-9);
            assertEquals(Set.of("Animation", "Family"), store.genres(upId));
            assertTrue(store.rating(upId, RatingSources.IMDB).isPresent());
        }

        @Test
        @DisplayName("A second pass fills nothing and makes no metadata calls")
        void testIdempotent() {
            when(provider.fetchMetadata("Up")).thenReturn(Optional.of(fullMetadata().build()));
            when(secondary.fetchById("tt1049413"))
                    .thenReturn(Optional.of(omdbPayload("96 min", "2009", "Balloons.")));
            when(scraper.fetchAll("tt1049413"))
                    .thenReturn(Optional.of(new ScrapedDetails(8.3, 1_100_000, null)));
            when(trendClient.fetch7DayAverage("Up")).thenReturn(OptionalInt.of(7));
            when(actorClient.fetchPopularity("Up")).thenReturn(OptionalDouble.of(50.0));
            EnrichmentOrchestrator orchestrator = orchestrator(scraper);

            EnrichmentReport first = orchestrator.enrichMovie(upId);
            EnrichmentReport second = orchestrator.enrichMovie(upId);

            assertTrue(first.filledAnything());
            assertFalse(second.filledAnything());
            assertEquals(first.combinedScore(), second.combinedScore());
            verify(provider, times(1)).fetchMetadata(any());
            verify(secondary, times(1)).fetchById(any());
            verify(scraper, times(1)).fetchAll(any());
            verify(trendClient, times(1)).fetch7DayAverage(any());
        }

        @Test
        @DisplayName("Existing values are never overwritten")
        void testNoOverwrite() {
            long id = store.addMovie(Movie.builder().title("Heat").year(1995).originCountry("US"));
            when(provider.fetchMetadata("Heat")).thenReturn(Optional.of(ProviderMetadata.builder()
                    .title("Heat").year(2000).originCountry("GB").durationSeconds(10_200).build()));

            EnrichmentReport report = orchestrator(null).enrichMovie(id);

            Movie movie = store.findById(id).orElseThrow();
            assertEquals(1995, movie.getYear());
            assertEquals("US", movie.getOriginCountry());
            assertEquals(10_200, movie.getDurationSeconds());
            assertFalse(report.filledFields().contains(MovieField.YEAR));
        }

        @Test
        @DisplayName("Should throw for an unknown movie")
        void testUnknownMovie() {
            assertThrows(MovieNotFoundException.class, () -> orchestrator(null).enrichMovie(404));
            verifyNoInteractions(provider);
        }
    }

    @Nested
    @DisplayName("Failure handling")
    class FailureTests {

        @Test
        @DisplayName("A rate limit aborts the pass and propagates")
        void testRateLimitPropagates() {
            when(provider.fetchMetadata("Up")).thenThrow(new RateLimitExceededException("tmdb", "429 Too Many Requests"));

            RateLimitExceededException e = assertThrows(RateLimitExceededException.class,
                    () -> orchestrator(scraper).enrichMovie(upId));

            assertEquals("tmdb", e.getProvider());
            verifyNoInteractions(secondary, scraper, trendClient);
        }

        @Test
        @DisplayName("A failing step is reported and later steps still run")
        void testStepFailureIsolated() {
            when(provider.fetchMetadata("Up")).thenThrow(new ProviderException("connection reset"));
            when(secondary.fetchByTitle(eq("Up"), any(), any()))
                    .thenReturn(Optional.of(omdbPayload("96 min", "2009", "Balloons.")));

            EnrichmentReport report = orchestrator(null).enrichMovie(upId);

            assertEquals(List.of(EnrichmentStep.PRIMARY_METADATA), report.failedSteps());
            assertFalse(report.isSuccessful());
            assertTrue(report.filledFields().contains(MovieField.PLOT));
            verify(metrics).recordEnrichmentDuration(eq(false), any());
        }

        @Test
        @DisplayName("Invalid provider trailer URLs are not written")
        void testInvalidTrailerSkipped() {
            when(provider.fetchMetadata("Up")).thenReturn(Optional.of(fullMetadata().trailerUrl("not-a-url").build()));

            EnrichmentReport report = orchestrator(null).enrichMovie(upId);

            assertFalse(report.filledFields().contains(MovieField.TRAILER_URL));
            assertTrue(store.isFieldMissing(upId, MovieField.TRAILER_URL));
        }
    }

    @Nested
    @DisplayName("Secondary identity check")
    class SecondaryTests {

        @Test
        @DisplayName("A title lookup that fingerprints as another film is rejected")
        void testMismatchRejected() {
            when(provider.fetchMetadata("Up")).thenReturn(Optional.of(fullMetadata()
                    .externalId(null)
                    .rawPayload(json("{\"title\": \"Up\", \"runtime\": 96, \"release_date\": \"2009-05-28\"}"))
                    .build()));
            when(secondary.fetchByTitle(eq("Up"), any(), any()))
                    .thenReturn(Optional.of(omdbPayload("140 min", "1984", "A different film.")));

            EnrichmentReport report = orchestrator(null).enrichMovie(upId);

            assertFalse(report.filledFields().contains(MovieField.PLOT));
            assertTrue(store.isFieldMissing(upId, MovieField.PLOT));
            verify(secondary, never()).fetchById(any());
            verify(secondary).fetchByTitle("Up", 96, 2009);
        }

        @Test
        @DisplayName("A title lookup that fingerprints as the same film is accepted")
        void testMatchAccepted() {
            when(provider.fetchMetadata("Up")).thenReturn(Optional.of(fullMetadata()
                    .externalId(null)
                    .rawPayload(json("{\"title\": \"Up\", \"runtime\": 96, \"release_date\": \"2009-05-28\"}"))
                    .build()));
            when(secondary.fetchByTitle(eq("Up"), any(), any()))
                    .thenReturn(Optional.of(omdbPayload("96 min", "2009", "Balloons.")));

            orchestrator(null).enrichMovie(upId);

            assertEquals("Balloons.", store.findById(upId).orElseThrow().getPlot());
            verify(metrics).incrementFieldFilled(MovieField.PLOT);
        }

        @Test
        @DisplayName("Without primary metadata a title lookup is checked against the stored row")
        void testStoredRowRejectsOtherFilm() {
            long id = store.addMovie(Movie.builder().title("Up").year(2009).durationSeconds(5760));
            when(provider.fetchMetadata("Up")).thenReturn(Optional.empty());
            when(secondary.fetchByTitle(eq("Up"), any(), any())).thenReturn(Optional.of(json("""
                    {"Title": "Heat", "Runtime": "170 min", "Year": "1995", "Plot": "A heist."}
                    """)));

            EnrichmentReport report = orchestrator(null).enrichMovie(id);

            assertFalse(report.filledFields().contains(MovieField.PLOT));
            assertTrue(store.isFieldMissing(id, MovieField.PLOT));
            verify(secondary).fetchByTitle("Up", 96, 2009);
        }

        @Test
        @DisplayName("Without primary metadata a title lookup matching the stored row is accepted")
        void testStoredRowAcceptsSameFilm() {
            long id = store.addMovie(Movie.builder().title("Up").year(2009).durationSeconds(5760));
            when(provider.fetchMetadata("Up")).thenReturn(Optional.empty());
            when(secondary.fetchByTitle(eq("Up"), any(), any()))
                    .thenReturn(Optional.of(omdbPayload("96 min", "2009", "Balloons.")));

            orchestrator(null).enrichMovie(id);

            assertEquals("Balloons.", store.findById(id).orElseThrow().getPlot());
        }

        @Test
        @DisplayName("A lookup by external id is trusted without fingerprinting")
        void testByIdTrusted() {
            store.updateField(upId, MovieField.EXTERNAL_ID, "tt1049413");
            when(secondary.fetchById("tt1049413"))
                    .thenReturn(Optional.of(omdbPayload("140 min", "1984", "Trusted plot.")));

            orchestrator(null).enrichMovie(upId);

            assertEquals("Trusted plot.", store.findById(upId).orElseThrow().getPlot());
            verify(secondary, never()).fetchByTitle(any(), any(), any());
        }
    }

    @Nested
    @DisplayName("Detail scraper")
    class ScraperTests {

        @Test
        @DisplayName("Skipped when no scraper is configured")
        void testNoScraper() {
            store.updateField(upId, MovieField.EXTERNAL_ID, "tt1049413");

            EnrichmentReport report = orchestrator(null).enrichMovie(upId);

            assertTrue(store.rating(upId, RatingSources.IMDB).isEmpty());
            assertNull(report.combinedScore());
        }

        @Test
        @DisplayName("Skipped when a primary rating sample already exists")
        void testExistingSample() {
            store.updateField(upId, MovieField.EXTERNAL_ID, "tt1049413");
            store.upsertRating(RatingSample.of(upId, RatingSources.IMDB, 80.0, 10));

            orchestrator(scraper).enrichMovie(upId);

            verifyNoInteractions(scraper);
        }

        @Test
        @DisplayName("Histograms are stored with the sample")
        void testHistogramSample() {
            store.updateField(upId, MovieField.EXTERNAL_ID, "tt1049413");
            RatingHistogram histogram = RatingHistogram.of(0, 0, 0, 0, 0, 0, 0, 10, 0, 10);
            when(scraper.fetchAll("tt1049413")).thenReturn(Optional.of(new ScrapedDetails(9.0, 20, histogram)));

            orchestrator(scraper).enrichMovie(upId);

            RatingSample sample = store.rating(upId, RatingSources.IMDB).orElseThrow();
            assertTrue(sample.hasHistogram());
            assertEquals(90.0, sample.score(), 1e-9);
            verify(rateLimiter).acquire(ThrottleKeys.SCRAPER);
        }

        @Test
        @DisplayName("Without a stored id the scraper uses the secondary lookup")
        void testExternalIdFallback() {
            when(secondary.getExternalId("Up")).thenReturn(Optional.of("tt1049413"));
            when(scraper.fetchAll("tt1049413")).thenReturn(Optional.of(new ScrapedDetails(8.3, 5, null)));

            orchestrator(scraper).enrichMovie(upId);

            assertEquals(83.0, store.rating(upId, RatingSources.IMDB).orElseThrow().score(), 1e-9);
        }
    }
}
