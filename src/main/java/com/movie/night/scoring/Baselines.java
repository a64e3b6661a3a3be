package com.movie.night.scoring;

import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Per-country reference shares the fairness adjustments compare against. Country keys are
 * upper-cased ISO-3166 alpha-2 codes; lookups are case-insensitive.
 *
 * @param populationShare     share of the world's internet users, 0-1
 * @param catalogueShare      share of the local catalogue, 0-1
 * @param internetPenetration fraction of the population online, 0-1
 */
public record Baselines(Map<String, Double> populationShare,
                        Map<String, Double> catalogueShare,
                        Map<String, Double> internetPenetration) {

    public Baselines {
        populationShare = normalizeKeys(populationShare, "populationShare");
        catalogueShare = normalizeKeys(catalogueShare, "catalogueShare");
        internetPenetration = normalizeKeys(internetPenetration, "internetPenetration");
    }

    public static Baselines empty() {
        return new Baselines(Map.of(), Map.of(), Map.of());
    }

    /**
     * How far a country is under-represented in the catalogue relative to its population
     * share; 0 when it is not, or when the country is unknown.
     */
    public double representationGap(String country) {
        if (country == null) {
            return 0.0;
        }
        String key = country.toUpperCase(Locale.ROOT);
        double gap = populationShare.getOrDefault(key, 0.0) - catalogueShare.getOrDefault(key, 0.0);
        return Math.max(gap, 0.0);
    }

    public OptionalDouble penetration(String country) {
        if (country == null) {
            return OptionalDouble.empty();
        }
        Double value = internetPenetration.get(country.toUpperCase(Locale.ROOT));
        return value != null ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    public Baselines withCatalogueShare(Map<String, Double> catalogueShare) {
        return new Baselines(populationShare, catalogueShare, internetPenetration);
    }

    private static Map<String, Double> normalizeKeys(Map<String, Double> shares, String name) {
        if (shares == null) {
            return Map.of();
        }
        Map<String, Double> normalized = new TreeMap<>();
        shares.forEach((country, share) -> {
            if (share == null || share.isNaN() || share < 0.0 || share > 1.0) {
                throw new IllegalArgumentException(name + " for " + country + " must be within [0, 1]");
            }
            normalized.put(country.toUpperCase(Locale.ROOT), share);
        });
        return Map.copyOf(normalized);
    }
}
