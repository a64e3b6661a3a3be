package com.movie.night.reference;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.MonthDay;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Tags a release date with the country's holiday or school-break window, falling back to
 * the hemisphere's meteorological season when no window covers the date.
 * Windows are inclusive; a window whose end precedes its start wraps over New Year.
 */
public class ReleaseWindowClassifier {

    private final Map<String, List<Window>> windowsByCountry;
    private final Set<String> southernHemisphere;
    private final List<String> northernSeasons;
    private final List<String> southernSeasons;

    ReleaseWindowClassifier(Map<String, List<Window>> windowsByCountry, Set<String> southernHemisphere,
                            List<String> northernSeasons, List<String> southernSeasons) {
        if (northernSeasons.size() != 4 || southernSeasons.size() != 4) {
            throw new ReferenceDataException("season lists must have four entries");
        }
        this.windowsByCountry = Map.copyOf(windowsByCountry);
        this.southernHemisphere = Set.copyOf(southernHemisphere);
        this.northernSeasons = List.copyOf(northernSeasons);
        this.southernSeasons = List.copyOf(southernSeasons);
    }

    /**
     * Loads the bundled window table.
     */
    public static ReleaseWindowClassifier fromClasspath() {
        return fromJson(ReferenceResources.read(ReferenceResources.RELEASE_WINDOWS));
    }

    static ReleaseWindowClassifier fromJson(JsonNode root) {
        Map<String, List<Window>> windows = new HashMap<>();
        root.path("countries").fields().forEachRemaining(entry -> {
            List<Window> list = new ArrayList<>();
            for (JsonNode w : entry.getValue()) {
                list.add(new Window(parseMonthDay(w.path("start").asText()),
                        parseMonthDay(w.path("end").asText()),
                        w.path("label").asText()));
            }
            windows.put(entry.getKey().toUpperCase(Locale.ROOT), List.copyOf(list));
        });
        Set<String> south = new HashSet<>();
        root.path("southernHemisphere").forEach(n -> south.add(n.asText().toUpperCase(Locale.ROOT)));
        return new ReleaseWindowClassifier(windows, south,
                textList(root.path("northernSeasons")), textList(root.path("southernSeasons")));
    }

    /**
     * Classifies an ISO-8601 date string. Returns null for a missing or unparseable date.
     */
    public String classify(String isoDate, String country) {
        if (isoDate == null || isoDate.isBlank()) {
            return null;
        }
        try {
            return classify(LocalDate.parse(isoDate.trim()), country);
        } catch (DateTimeException e) {
            return null;
        }
    }

    public String classify(LocalDate date, String country) {
        String code = country != null ? country.toUpperCase(Locale.ROOT) : "";
        MonthDay day = MonthDay.from(date);
        for (Window window : windowsByCountry.getOrDefault(code, List.of())) {
            if (window.contains(day)) {
                return window.label();
            }
        }
        List<String> seasons = southernHemisphere.contains(code) ? southernSeasons : northernSeasons;
        return seasons.get((date.getMonthValue() % 12) / 3);
    }

    private static MonthDay parseMonthDay(String mmdd) {
        try {
            return MonthDay.parse("--" + mmdd);
        } catch (DateTimeException e) {
            throw new ReferenceDataException("Invalid window boundary: " + mmdd, e);
        }
    }

    private static List<String> textList(JsonNode array) {
        List<String> values = new ArrayList<>();
        array.forEach(n -> values.add(n.asText()));
        return values;
    }

    record Window(MonthDay start, MonthDay end, String label) {
        boolean contains(MonthDay day) {
            if (!start.isAfter(end)) {
                return !day.isBefore(start) && !day.isAfter(end);
            }
            return !day.isBefore(start) || !day.isAfter(end);
        }
    }
}
