package com.movie.night.identity;

import com.movie.night.metrics.MetricsService;
import com.movie.night.metrics.NoOpMetricsService;
import com.movie.night.similarity.CosineSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Decides whether two fingerprints describe the same film.
 *
 * <p>When both sides carry an external id, id equality is decisive. Otherwise the
 * title cosine, runtime tolerance and year tolerance signals are blended, each weighted
 * only when both sides provide it, and the blend is normalized by the weight actually
 * available. The comparison is symmetric.</p>
 */
public class IdentityMatcher {
    private static final Logger log = LoggerFactory.getLogger(IdentityMatcher.class);

    // Absorbs floating-point error in sums such as 0.6 + 0.2.
    private static final double THRESHOLD_EPSILON = 1e-9;

    private final MatchOptions options;
    private final MetricsService metricsService;

    public IdentityMatcher() {
        this(MatchOptions.defaults(), new NoOpMetricsService());
    }

    public IdentityMatcher(MatchOptions options) {
        this(options, new NoOpMetricsService());
    }

    public IdentityMatcher(MatchOptions options, MetricsService metricsService) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService must not be null");
    }

    public IdentityMatch sameMovie(MovieFingerprint a, MovieFingerprint b) {
        Objects.requireNonNull(a, "first fingerprint must not be null");
        Objects.requireNonNull(b, "second fingerprint must not be null");

        if (a.hasExternalId() && b.hasExternalId()) {
            boolean equal = a.externalId().equals(b.externalId());
            log.debug("identity.compared rule=externalId a={} b={} match={}", a.externalId(), b.externalId(), equal);
            IdentityMatch result = new IdentityMatch(equal, equal ? 1.0 : 0.0);
            metricsService.recordIdentityMatch(result.isMatch(), result.confidence());
            return result;
        }

        double score = 0.0;
        double weight = 0.0;

        if (a.hasTitleEmbedding() && b.hasTitleEmbedding()) {
            double cosine = CosineSimilarity.computeClamped(a.titleEmbedding(), b.titleEmbedding());
            score += options.getTitleWeight() * cosine;
            weight += options.getTitleWeight();
        }
        if (a.runtimeMinutes() != null && b.runtimeMinutes() != null) {
            boolean close = Math.abs(a.runtimeMinutes() - b.runtimeMinutes()) <= options.getRuntimeToleranceMinutes();
            score += close ? options.getRuntimeWeight() : 0.0;
            weight += options.getRuntimeWeight();
        }
        if (a.releaseYear() != null && b.releaseYear() != null) {
            boolean close = Math.abs(a.releaseYear() - b.releaseYear()) <= options.getYearTolerance();
            score += close ? options.getYearWeight() : 0.0;
            weight += options.getYearWeight();
        }

        if (weight == 0.0) {
            log.debug("identity.compared rule=none a={} b={}", a.title(), b.title());
            IdentityMatch result = IdentityMatch.insufficientData();
            metricsService.recordIdentityMatch(false, 0.0);
            return result;
        }

        double confidence = Math.min(1.0, Math.max(0.0, score / weight));
        boolean match = confidence >= options.getThreshold() - THRESHOLD_EPSILON;
        log.debug("identity.compared rule=weighted a='{}' b='{}' confidence={} match={}",
                a.title(), b.title(), confidence, match);
        metricsService.recordIdentityMatch(match, confidence);
        return new IdentityMatch(match, confidence);
    }

    public MatchOptions getOptions() {
        return options;
    }
}
