package com.movie.night.similarity;

import com.movie.night.model.Movie;
import com.movie.night.reference.AgeGroup;
import com.movie.night.reference.CertificationSchemes;
import com.movie.night.store.MovieStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pairwise similarity for a drawn group of movies. Each pair scores
 * {@code numeric * cosine(features) + categorical * mean(exactMatches, jaccard(genres), jaccard(themes))}.
 */
public class GroupSimilarityEngine {
    private static final Logger log = LoggerFactory.getLogger(GroupSimilarityEngine.class);

    private static final double ROUNDING = 1000.0;

    private final MovieStore store;
    private final CertificationSchemes certificationSchemes;
    private final SimilarityWeights weights;

    public GroupSimilarityEngine(MovieStore store, CertificationSchemes certificationSchemes) {
        this(store, certificationSchemes, SimilarityWeights.defaults());
    }

    public GroupSimilarityEngine(MovieStore store, CertificationSchemes certificationSchemes,
                                 SimilarityWeights weights) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.certificationSchemes = Objects.requireNonNull(certificationSchemes, "certificationSchemes must not be null");
        this.weights = Objects.requireNonNull(weights, "weights must not be null");
    }

    /**
     * Similarity of every unordered pair. Duplicate ids are collapsed, keeping the first
     * occurrence; pairs follow input order.
     */
    public List<PairSimilarity> calculate(List<Movie> movies) {
        Objects.requireNonNull(movies, "movies must not be null");
        Map<Long, Movie> unique = new LinkedHashMap<>();
        for (Movie movie : movies) {
            unique.putIfAbsent(movie.getId(), movie);
        }
        List<SimilarityProfile> profiles = new ArrayList<>(unique.size());
        for (Movie movie : unique.values()) {
            profiles.add(profileOf(movie));
        }
        return calculateProfiles(profiles);
    }

    /**
     * Same as {@link #calculate(List)} for profiles that are already built.
     */
    public List<PairSimilarity> calculateProfiles(List<SimilarityProfile> profiles) {
        Map<Long, SimilarityProfile> unique = new LinkedHashMap<>();
        for (SimilarityProfile profile : profiles) {
            unique.putIfAbsent(profile.movieId(), profile);
        }
        List<SimilarityProfile> distinct = new ArrayList<>(unique.values());

        List<PairSimilarity> pairs = new ArrayList<>();
        for (int i = 0; i < distinct.size(); i++) {
            for (int j = i + 1; j < distinct.size(); j++) {
                SimilarityProfile a = distinct.get(i);
                SimilarityProfile b = distinct.get(j);
                pairs.add(new PairSimilarity(a.movieId(), b.movieId(), similarity(a, b)));
            }
        }
        log.debug("similarity.calculated movies={} pairs={}", distinct.size(), pairs.size());
        return pairs;
    }

    /**
     * Similarity of two profiles, rounded to 3 decimals. A profile compared with itself scores 1.0.
     */
    public double similarity(SimilarityProfile a, SimilarityProfile b) {
        double score = weights.numeric() * numericSimilarity(a, b)
                + weights.categorical() * categoricalSimilarity(a, b);
        double rounded = Math.round(score * ROUNDING) / ROUNDING;
        return Math.max(0.0, Math.min(1.0, rounded));
    }

    public SimilarityProfile profileOf(Movie movie) {
        AgeGroup ageGroup = certificationSchemes.ageGroup(movie.getOriginCountry(), movie.getRatingCertification());
        return SimilarityProfile.of(movie, ageGroup, store.genres(movie.getId()), store.themes(movie.getId()));
    }

    static double numericSimilarity(SimilarityProfile a, SimilarityProfile b) {
        double[] va = a.numericFeatures();
        double[] vb = b.numericFeatures();
        if (Arrays.equals(va, vb)) {
            return 1.0;
        }
        return CosineSimilarity.computeClamped(va, vb);
    }

    static double categoricalSimilarity(SimilarityProfile a, SimilarityProfile b) {
        int matches = 0;
        if (Objects.equals(a.releaseWindow(), b.releaseWindow())) {
            matches++;
        }
        if (a.ageGroup() == b.ageGroup()) {
            matches++;
        }
        if (Objects.equals(a.originCountry(), b.originCountry())) {
            matches++;
        }
        double exact = matches / 3.0;
        double genres = JaccardSimilarity.compute(a.genres(), b.genres());
        double themes = JaccardSimilarity.compute(a.themes(), b.themes());
        return (exact + genres + themes) / 3.0;
    }
}
