package com.movie.night.similarity;

import com.movie.night.model.Movie;
import com.movie.night.reference.AgeGroup;
import com.movie.night.reference.CertificationSchemes;
import com.movie.night.store.InMemoryMovieStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GroupSimilarityEngine Tests")
class GroupSimilarityEngineTest {

    private InMemoryMovieStore store;
    private GroupSimilarityEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryMovieStore();
        engine = new GroupSimilarityEngine(store, CertificationSchemes.fromClasspath());
    }

    private Movie addMovie(Movie.Builder builder, String... genres) {
        long id = store.addMovie(builder);
        for (String genre : genres) {
            store.linkGenre(id, genre);
        }
        return store.findById(id).orElseThrow();
    }

    @Test
    @DisplayName("A profile compared with itself scores 1.0")
    void testReflexive() {
        Movie up = addMovie(Movie.builder().title("Up").year(2009).durationSeconds(5760)
                .originCountry("US").ratingCertification("PG").releaseWindow("memorial_lead")
                .boxOfficeActual(735_099_082L).combinedScore(88.0), "Animation", "Family");
        SimilarityProfile profile = engine.profileOf(up);

        assertEquals(1.0, engine.similarity(profile, profile));
    }

    @Test
    @DisplayName("Every unordered pair is scored once, within [0, 1]")
    void testPairsAndBounds() {
        Movie up = addMovie(Movie.builder().title("Up").year(2009).durationSeconds(5760)
                .originCountry("US").ratingCertification("PG"), "Animation", "Family");
        Movie heat = addMovie(Movie.builder().title("Heat").year(1995).durationSeconds(10_200)
                .originCountry("US").ratingCertification("R").boxOfficeActual(187_436_818L), "Crime", "Drama");
        Movie amelie = addMovie(Movie.builder().title("Amélie").year(2001).durationSeconds(7320)
                .originCountry("FR").ratingCertification("U").googleTrendScore(35.0), "Comedy", "Romance");

        List<PairSimilarity> pairs = engine.calculate(List.of(up, heat, amelie));

        assertEquals(3, pairs.size());
        assertEquals(up.getId(), pairs.get(0).movieIdA());
        assertEquals(heat.getId(), pairs.get(0).movieIdB());
        for (PairSimilarity pair : pairs) {
            assertTrue(pair.similarity() >= 0.0 && pair.similarity() <= 1.0);
            assertNotEquals(pair.movieIdA(), pair.movieIdB());
        }
    }

    @Test
    @DisplayName("Duplicate movies are collapsed")
    void testDuplicates() {
        Movie up = addMovie(Movie.builder().title("Up"));
        Movie heat = addMovie(Movie.builder().title("Heat"));

        List<PairSimilarity> pairs = engine.calculate(List.of(up, heat, up));

        assertEquals(1, pairs.size());
        assertTrue(pairs.get(0).involves(up.getId()));
        assertTrue(pairs.get(0).involves(heat.getId()));
    }

    @Test
    @DisplayName("Fewer than two movies produce no pairs")
    void testTooFewMovies() {
        assertTrue(engine.calculate(List.of()).isEmpty());
        assertTrue(engine.calculate(List.of(addMovie(Movie.builder().title("Up")))).isEmpty());
    }

    @Test
    @DisplayName("Categorical part averages exact matches and label overlaps")
    void testCategoricalSimilarity() {
        double[] features = {0.1, 0.2, 0.0, 0.0, 0.0, 0.0};
        SimilarityProfile a = new SimilarityProfile(1, features, "summer", AgeGroup.KIDS, "US",
                Set.of("Animation", "Family"), Set.of());
        SimilarityProfile b = new SimilarityProfile(2, features, "summer", AgeGroup.KIDS, "US",
                Set.of("Family", "Comedy"), Set.of());

        // (3/3 + 1/3 + 1) / 3
        assertEquals(7.0 / 9.0, GroupSimilarityEngine.categoricalSimilarity(a, b), 1e-9);
        // 0.6 * 1.0 + 0.4 * 7/9, rounded to three decimals
        assertEquals(0.911, engine.similarity(a, b), 1e-9);
    }

    @Test
    @DisplayName("Numeric features scale year, runtime and box office")
    void testNumericFeatures() {
        Movie movie = Movie.builder().id(1).title("Up").year(2050).durationSeconds(3600)
                .boxOfficeActual(1_000_000L).googleTrendScore(50.0).build();

        double[] features = SimilarityProfile.numericFeatures(movie);

        assertArrayEquals(new double[]{1.0, 1.0, 6.0, 0.5, 0.0, 0.0}, features, 1e-9);
    }

    @Test
    @DisplayName("Weights must sum to one")
    void testWeightsValidation() {
        assertThrows(IllegalArgumentException.class, () -> new SimilarityWeights(0.5, 0.4));
        assertThrows(IllegalArgumentException.class, () -> new SimilarityWeights(-0.1, 1.1));
    }
}
