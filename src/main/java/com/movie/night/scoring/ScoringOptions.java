package com.movie.night.scoring;

import com.movie.night.model.RatingSources;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Tunables for {@link FairnessScoringEngine}.
 */
public class ScoringOptions {

    private static final double DEFAULT_BONUS_SCALE = 5.0;
    private static final double DEFAULT_ORIGIN_WEIGHT_SCALE = 3.0;
    private static final double DEFAULT_PENETRATION = 0.35;
    private static final double MIN_PENETRATION = 0.05;

    private final Map<String, Double> sourcePenalties;
    private final double bonusScale;
    private final double originWeightScale;
    private final double defaultPenetration;

    private ScoringOptions(Builder builder) {
        this.sourcePenalties = Map.copyOf(builder.sourcePenalties);
        this.bonusScale = builder.bonusScale;
        this.originWeightScale = builder.originWeightScale;
        this.defaultPenetration = builder.defaultPenetration;
    }

    /**
     * Penalty divisor for a source; 1.0 for sources without one.
     */
    public double penalty(String source) {
        if (source == null) {
            return 1.0;
        }
        return sourcePenalties.getOrDefault(source.toUpperCase(Locale.ROOT), 1.0);
    }

    public Map<String, Double> getSourcePenalties() {
        return sourcePenalties;
    }

    public double getBonusScale() {
        return bonusScale;
    }

    public double getOriginWeightScale() {
        return originWeightScale;
    }

    public double getDefaultPenetration() {
        return defaultPenetration;
    }

    public double getMinPenetration() {
        return MIN_PENETRATION;
    }

    /**
     * Penalties IMDB 1.5, METACRITIC 1.2, RT_CRITIC 1.2; bonus scale 5; origin weight scale 3;
     * penetration 0.35 for unknown countries.
     */
    public static ScoringOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, Double> sourcePenalties = new HashMap<>(Map.of(
                RatingSources.IMDB, 1.5,
                RatingSources.METACRITIC, 1.2,
                RatingSources.RT_CRITIC, 1.2));
        private double bonusScale = DEFAULT_BONUS_SCALE;
        private double originWeightScale = DEFAULT_ORIGIN_WEIGHT_SCALE;
        private double defaultPenetration = DEFAULT_PENETRATION;

        public Builder sourcePenalty(String source, double penalty) {
            if (penalty <= 0.0) {
                throw new IllegalArgumentException("penalty must be positive");
            }
            sourcePenalties.put(source.trim().toUpperCase(Locale.ROOT), penalty);
            return this;
        }

        public Builder bonusScale(double bonusScale) {
            if (bonusScale < 0.0) {
                throw new IllegalArgumentException("bonusScale must be non-negative");
            }
            this.bonusScale = bonusScale;
            return this;
        }

        public Builder originWeightScale(double originWeightScale) {
            if (originWeightScale < 0.0) {
                throw new IllegalArgumentException("originWeightScale must be non-negative");
            }
            this.originWeightScale = originWeightScale;
            return this;
        }

        public Builder defaultPenetration(double defaultPenetration) {
            if (defaultPenetration <= 0.0 || defaultPenetration > 1.0) {
                throw new IllegalArgumentException("defaultPenetration must be in (0.0, 1.0]");
            }
            this.defaultPenetration = defaultPenetration;
            return this;
        }

        public ScoringOptions build() {
            return new ScoringOptions(this);
        }
    }

    @Override
    public String toString() {
        return "ScoringOptions{" +
                "sourcePenalties=" + sourcePenalties +
                ", bonusScale=" + bonusScale +
                ", originWeightScale=" + originWeightScale +
                ", defaultPenetration=" + defaultPenetration +
                '}';
    }
}
