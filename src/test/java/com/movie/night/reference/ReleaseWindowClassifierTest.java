package com.movie.night.reference;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReleaseWindowClassifier Tests")
class ReleaseWindowClassifierTest {

    private static ReleaseWindowClassifier classifier;

    @BeforeAll
    static void load() {
        classifier = ReleaseWindowClassifier.fromClasspath();
    }

    @ParameterizedTest(name = "{0} in {1} -> {2}")
    @CsvSource({
            "2009-05-28, US, memorial_lead",
            "2009-07-04, US, summer_blockbuster",
            "2009-11-25, us, thanksgiving",
            "2020-12-25, ES, navidad_reyes",
            "2021-01-03, ES, navidad_reyes",
            "2019-01-05, RU, new_year_rus",
            "2019-10-20, IN, diwali"
    })
    @DisplayName("Dates inside a country window get the window label")
    void testCountryWindows(String date, String country, String expected) {
        assertEquals(expected, classifier.classify(date, country));
    }

    @ParameterizedTest(name = "{0} in {1} -> {2}")
    @CsvSource({
            "2010-10-10, US, fall",
            "2010-04-02, US, spring",
            "2010-12-05, XX, winter",
            "2010-01-20, AU, summer",
            "2010-04-20, AU, fall",
            "2010-07-20, NZ, winter",
            "2010-10-20, CL, spring"
    })
    @DisplayName("Dates outside every window fall back to the hemisphere's season")
    void testSeasonFallback(String date, String country, String expected) {
        assertEquals(expected, classifier.classify(date, country));
    }

    @Test
    @DisplayName("A missing country uses northern seasons")
    void testNullCountry() {
        assertEquals("summer", classifier.classify(LocalDate.of(2015, 7, 1), null));
    }

    @Test
    @DisplayName("Missing or malformed dates are not classified")
    void testBadDates() {
        assertNull(classifier.classify((String) null, "US"));
        assertNull(classifier.classify("  ", "US"));
        assertNull(classifier.classify("28/05/2009", "US"));
    }

    @Test
    @DisplayName("Rejects season lists without four entries")
    void testInvalidSeasons() throws Exception {
        var root = new ObjectMapper().readTree("""
                {"northernSeasons": ["winter", "summer"], "southernSeasons": ["a", "b", "c", "d"], "countries": {}}
                """);

        assertThrows(ReferenceDataException.class, () -> ReleaseWindowClassifier.fromJson(root));
    }

    @Test
    @DisplayName("Rejects malformed window boundaries")
    void testInvalidBoundary() throws Exception {
        var root = new ObjectMapper().readTree("""
                {"northernSeasons": ["w", "sp", "su", "f"], "southernSeasons": ["su", "f", "w", "sp"],
                 "countries": {"US": [{"start": "13-01", "end": "12-31", "label": "broken"}]}}
                """);

        assertThrows(ReferenceDataException.class, () -> ReleaseWindowClassifier.fromJson(root));
    }
}
