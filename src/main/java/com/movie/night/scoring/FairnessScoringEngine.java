package com.movie.night.scoring;

import com.movie.night.metrics.MetricsService;
import com.movie.night.metrics.NoOpMetricsService;
import com.movie.night.model.RatingHistogram;
import com.movie.night.model.RatingSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Demographically adjusted scores. Every signal is re-weighted against how well the movie's
 * origin country is represented in the catalogue compared to its share of internet users.
 *
 * <p>The combined score fuses per-source means into a 0-100 value. Histogram sources are
 * weighted by the inverse of their Beta posterior variance, scalar sources by their sample
 * count, and both by {@link #demographicWeight(String, String)}. The result then receives
 * {@link #fairnessBonus(String)} flat points.</p>
 */
public class FairnessScoringEngine {
    private static final Logger log = LoggerFactory.getLogger(FairnessScoringEngine.class);

    static final double MAX_SCORE = 100.0;
    static final double ACTOR_POPULARITY_WEIGHT = 0.3;
    static final double ACTOR_TREND_WEIGHT = 0.7;
    static final double MAX_ACTOR_BONUS = 2.5;

    private final Baselines baselines;
    private final ScoringOptions options;
    private final MetricsService metrics;

    public FairnessScoringEngine(Baselines baselines) {
        this(baselines, ScoringOptions.defaults(), new NoOpMetricsService());
    }

    public FairnessScoringEngine(Baselines baselines, ScoringOptions options) {
        this(baselines, options, new NoOpMetricsService());
    }

    public FairnessScoringEngine(Baselines baselines, ScoringOptions options, MetricsService metrics) {
        this.baselines = Objects.requireNonNull(baselines, "baselines must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Beta posterior over a 10-bucket histogram with add-one smoothing:
     * {@code alpha = 1 + sum(k * c_k)}, {@code beta = 1 + sum((11 - k) * c_k)}.
     * An empty histogram yields mean 5.0 and variance 8.33.
     */
    public Posterior posterior(RatingHistogram histogram) {
        Objects.requireNonNull(histogram, "histogram must not be null");
        double alpha = 1.0;
        double beta = 1.0;
        for (int star = 1; star <= RatingHistogram.BUCKETS; star++) {
            long count = histogram.count(star);
            alpha += (double) star * count;
            beta += (double) (RatingHistogram.BUCKETS + 1 - star) * count;
        }
        double sum = alpha + beta;
        double mean = alpha / sum * 10.0;
        double variance = (alpha * beta) / (sum * sum * (sum + 1.0)) * 100.0;
        return new Posterior(mean, variance);
    }

    /**
     * {@code (1 + scale * gap(origin)) / penalty(source)}.
     */
    public double demographicWeight(String source, String origin) {
        double originBonus = 1.0 + options.getOriginWeightScale() * baselines.representationGap(origin);
        return originBonus / options.penalty(source);
    }

    /**
     * Flat points for an under-represented origin, rounded to 2 decimals.
     */
    public double fairnessBonus(String origin) {
        return round2(options.getBonusScale() * baselines.representationGap(origin));
    }

    /**
     * Combined 0-100 score, or empty when there are no samples.
     */
    public OptionalDouble combinedScore(String origin, List<RatingSample> samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        if (samples.isEmpty()) {
            return OptionalDouble.empty();
        }

        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (RatingSample sample : samples) {
            double mean;
            double weight;
            if (sample.hasHistogram()) {
                Posterior posterior = posterior(sample.histogram());
                mean = posterior.mean();
                weight = 1.0 / posterior.variance();
            } else {
                mean = sample.score() / 10.0;
                Integer count = sample.sampleCount();
                // an unknown count weighs as one vote, a zero count not at all
                weight = count == null ? 1.0 : count;
            }
            weight *= demographicWeight(sample.source(), origin);
            weightedSum += mean * weight;
            totalWeight += weight;
        }
        if (totalWeight <= 0.0) {
            return OptionalDouble.empty();
        }

        double raw = weightedSum / totalWeight * 10.0;
        double score = round2(clamp(raw + fairnessBonus(origin)));
        metrics.recordCombinedScore(score);
        log.debug("score.combined origin={} samples={} raw={} score={}", origin, samples.size(), raw, score);
        return OptionalDouble.of(score);
    }

    /**
     * Raw trend divided by the origin's internet penetration (0.35 when unknown, never below
     * 0.05), capped at 100.
     */
    public double googleTrendFair(double rawTrend, String country) {
        double penetration = Math.max(
                baselines.penetration(country).orElse(options.getDefaultPenetration()),
                options.getMinPenetration());
        return clamp(round2(rawTrend / penetration));
    }

    /**
     * 30% actor popularity, 70% trend, plus half the fairness bonus (at most 2.5), capped at 100.
     */
    public double actorTrendFair(double popularity, double googleTrend, String origin) {
        double raw = ACTOR_POPULARITY_WEIGHT * popularity + ACTOR_TREND_WEIGHT * googleTrend;
        double bonus = Math.min(fairnessBonus(origin) / 2.0, MAX_ACTOR_BONUS);
        return round2(clamp(raw + bonus));
    }

    public Baselines getBaselines() {
        return baselines;
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(score, MAX_SCORE));
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
