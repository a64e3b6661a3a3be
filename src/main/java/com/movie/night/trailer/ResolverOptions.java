package com.movie.night.trailer;

/**
 * Tunables for {@link TrailerResolver}.
 */
public class ResolverOptions {

    private static final double DEFAULT_FUZZY_CUTOFF = 0.80;
    private static final int DEFAULT_SECONDARY_MAX_RETRIES = 3;

    private final boolean fuzzyLocalLookup;
    private final double fuzzyCutoff;
    private final int secondaryMaxRetries;

    private ResolverOptions(Builder builder) {
        this.fuzzyLocalLookup = builder.fuzzyLocalLookup;
        this.fuzzyCutoff = builder.fuzzyCutoff;
        this.secondaryMaxRetries = builder.secondaryMaxRetries;
    }

    public boolean isFuzzyLocalLookup() {
        return fuzzyLocalLookup;
    }

    public double getFuzzyCutoff() {
        return fuzzyCutoff;
    }

    public int getSecondaryMaxRetries() {
        return secondaryMaxRetries;
    }

    /**
     * Fuzzy local lookup on with cutoff 0.80, three retries for the broad search.
     */
    public static ResolverOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean fuzzyLocalLookup = true;
        private double fuzzyCutoff = DEFAULT_FUZZY_CUTOFF;
        private int secondaryMaxRetries = DEFAULT_SECONDARY_MAX_RETRIES;

        public Builder fuzzyLocalLookup(boolean fuzzyLocalLookup) {
            this.fuzzyLocalLookup = fuzzyLocalLookup;
            return this;
        }

        public Builder fuzzyCutoff(double fuzzyCutoff) {
            if (fuzzyCutoff <= 0.0 || fuzzyCutoff > 1.0) {
                throw new IllegalArgumentException("fuzzyCutoff must be in (0.0, 1.0]");
            }
            this.fuzzyCutoff = fuzzyCutoff;
            return this;
        }

        public Builder secondaryMaxRetries(int secondaryMaxRetries) {
            if (secondaryMaxRetries < 1) {
                throw new IllegalArgumentException("secondaryMaxRetries must be at least 1");
            }
            this.secondaryMaxRetries = secondaryMaxRetries;
            return this;
        }

        public ResolverOptions build() {
            return new ResolverOptions(this);
        }
    }

    @Override
    public String toString() {
        return "ResolverOptions{" +
                "fuzzyLocalLookup=" + fuzzyLocalLookup +
                ", fuzzyCutoff=" + fuzzyCutoff +
                ", secondaryMaxRetries=" + secondaryMaxRetries +
                '}';
    }
}
