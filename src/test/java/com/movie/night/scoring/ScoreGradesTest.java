package com.movie.night.scoring;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ScoreGradesTest {

    @ParameterizedTest
    @CsvSource({
            "100, S", "97, A+", "96.99, A", "92, A", "75, A-", "74.99, B+", "68, B+", "62, B",
            "55, B-", "48, C+", "42, C", "35, C-", "25, D", "15, E", "14.99, F", "0, F", "-3, F"
    })
    @DisplayName("Scores map to the band whose lower bound they reach")
    void testBands(double score, String grade) {
        assertEquals(grade, ScoreGrades.toGrade(score));
    }

    @Test
    @DisplayName("Should reject NaN")
    void testNaN() {
        assertThrows(IllegalArgumentException.class, () -> ScoreGrades.toGrade(Double.NaN));
    }
}
