package com.movie.night.scoring;

/**
 * Letter grade bands for 0-100 scores.
 */
public final class ScoreGrades {

    private static final double[] LOWER_BOUNDS = {100, 97, 92, 75, 68, 62, 55, 48, 42, 35, 25, 15, 0};
    private static final String[] GRADES = {"S", "A+", "A", "A-", "B+", "B", "B-", "C+", "C", "C-", "D", "E", "F"};

    private ScoreGrades() {
    }

    /**
     * Highest band whose lower bound the score reaches. Scores below 0 grade as F.
     */
    public static String toGrade(double score) {
        if (Double.isNaN(score)) {
            throw new IllegalArgumentException("score must be a number");
        }
        for (int i = 0; i < LOWER_BOUNDS.length; i++) {
            if (score >= LOWER_BOUNDS[i]) {
                return GRADES[i];
            }
        }
        return GRADES[GRADES.length - 1];
    }
}
