package com.movie.night.reference;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Per-country film certification schemes and the age implied by a certification symbol.
 */
public class CertificationSchemes {

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private final Map<String, Integer> letterAges;
    private final Map<String, String> adultCutoffByCountry;

    CertificationSchemes(Map<String, Integer> letterAges, Map<String, String> adultCutoffByCountry) {
        this.letterAges = Map.copyOf(letterAges);
        this.adultCutoffByCountry = Map.copyOf(adultCutoffByCountry);
    }

    public static CertificationSchemes fromClasspath() {
        return fromJson(ReferenceResources.read(ReferenceResources.RATING_SCHEMES));
    }

    static CertificationSchemes fromJson(JsonNode root) {
        Map<String, Integer> letters = new HashMap<>();
        root.path("letterAges").fields().forEachRemaining(e ->
                letters.put(e.getKey().toUpperCase(Locale.ROOT), e.getValue().asInt()));
        Map<String, String> cutoffs = new HashMap<>();
        root.path("schemes").fields().forEachRemaining(e -> {
            JsonNode cutoff = e.getValue().get("adultCutoff");
            if (cutoff != null && cutoff.isTextual()) {
                cutoffs.put(e.getKey().toUpperCase(Locale.ROOT), cutoff.asText());
            }
        });
        return new CertificationSchemes(letters, cutoffs);
    }

    /**
     * Minimum recommended age implied by a symbol: the first digit group if there is one,
     * otherwise a lookup of the symbol in the letter table.
     */
    public OptionalInt minimumAge(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return OptionalInt.empty();
        }
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        Matcher matcher = DIGITS.matcher(normalized);
        if (matcher.find()) {
            try {
                return OptionalInt.of(Integer.parseInt(matcher.group()));
            } catch (NumberFormatException e) {
                return OptionalInt.empty();
            }
        }
        Integer age = letterAges.get(normalized);
        return age != null ? OptionalInt.of(age) : OptionalInt.empty();
    }

    /**
     * Maps a local certification to an {@link AgeGroup}. The country's adult cutoff symbol is
     * always {@code ADULT}; other symbols go by their minimum age, {@code UNKNOWN} without one.
     */
    public AgeGroup ageGroup(String country, String symbol) {
        if (country != null && symbol != null) {
            String cutoff = adultCutoffByCountry.get(country.toUpperCase(Locale.ROOT));
            if (cutoff != null && cutoff.equalsIgnoreCase(symbol.trim())) {
                return AgeGroup.ADULT;
            }
        }
        OptionalInt age = minimumAge(symbol);
        return age.isPresent() ? AgeGroup.forMinimumAge(age.getAsInt()) : AgeGroup.UNKNOWN;
    }
}
