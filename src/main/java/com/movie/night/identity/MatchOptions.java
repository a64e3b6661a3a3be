package com.movie.night.identity;

/**
 * Tunables for {@link IdentityMatcher}: signal weights, tolerances and the match threshold.
 */
public class MatchOptions {

    private static final double DEFAULT_THRESHOLD = 0.80;
    private static final int DEFAULT_RUNTIME_TOLERANCE_MINUTES = 10;
    private static final int DEFAULT_YEAR_TOLERANCE = 1;
    private static final double DEFAULT_TITLE_WEIGHT = 0.60;
    private static final double DEFAULT_RUNTIME_WEIGHT = 0.20;
    private static final double DEFAULT_YEAR_WEIGHT = 0.20;

    private final double threshold;
    private final int runtimeToleranceMinutes;
    private final int yearTolerance;
    private final double titleWeight;
    private final double runtimeWeight;
    private final double yearWeight;

    private MatchOptions(Builder builder) {
        this.threshold = builder.threshold;
        this.runtimeToleranceMinutes = builder.runtimeToleranceMinutes;
        this.yearTolerance = builder.yearTolerance;
        this.titleWeight = builder.titleWeight;
        this.runtimeWeight = builder.runtimeWeight;
        this.yearWeight = builder.yearWeight;
    }

    public double getThreshold() {
        return threshold;
    }

    public int getRuntimeToleranceMinutes() {
        return runtimeToleranceMinutes;
    }

    public int getYearTolerance() {
        return yearTolerance;
    }

    public double getTitleWeight() {
        return titleWeight;
    }

    public double getRuntimeWeight() {
        return runtimeWeight;
    }

    public double getYearWeight() {
        return yearWeight;
    }

    /**
     * Threshold 0.80, runtime within 10 minutes, year within 1, weights 0.6 / 0.2 / 0.2.
     */
    public static MatchOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double threshold = DEFAULT_THRESHOLD;
        private int runtimeToleranceMinutes = DEFAULT_RUNTIME_TOLERANCE_MINUTES;
        private int yearTolerance = DEFAULT_YEAR_TOLERANCE;
        private double titleWeight = DEFAULT_TITLE_WEIGHT;
        private double runtimeWeight = DEFAULT_RUNTIME_WEIGHT;
        private double yearWeight = DEFAULT_YEAR_WEIGHT;

        public Builder threshold(double threshold) {
            validateFraction(threshold, "threshold");
            this.threshold = threshold;
            return this;
        }

        public Builder runtimeToleranceMinutes(int runtimeToleranceMinutes) {
            if (runtimeToleranceMinutes < 0) {
                throw new IllegalArgumentException("runtimeToleranceMinutes must be non-negative");
            }
            this.runtimeToleranceMinutes = runtimeToleranceMinutes;
            return this;
        }

        public Builder yearTolerance(int yearTolerance) {
            if (yearTolerance < 0) {
                throw new IllegalArgumentException("yearTolerance must be non-negative");
            }
            this.yearTolerance = yearTolerance;
            return this;
        }

        public Builder titleWeight(double titleWeight) {
            validateFraction(titleWeight, "titleWeight");
            this.titleWeight = titleWeight;
            return this;
        }

        public Builder runtimeWeight(double runtimeWeight) {
            validateFraction(runtimeWeight, "runtimeWeight");
            this.runtimeWeight = runtimeWeight;
            return this;
        }

        public Builder yearWeight(double yearWeight) {
            validateFraction(yearWeight, "yearWeight");
            this.yearWeight = yearWeight;
            return this;
        }

        public MatchOptions build() {
            if (titleWeight + runtimeWeight + yearWeight <= 0.0) {
                throw new IllegalArgumentException("at least one signal weight must be positive");
            }
            return new MatchOptions(this);
        }

        private void validateFraction(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }

    @Override
    public String toString() {
        return "MatchOptions{" +
                "threshold=" + threshold +
                ", runtimeToleranceMinutes=" + runtimeToleranceMinutes +
                ", yearTolerance=" + yearTolerance +
                ", titleWeight=" + titleWeight +
                ", runtimeWeight=" + runtimeWeight +
                ", yearWeight=" + yearWeight +
                '}';
    }
}
