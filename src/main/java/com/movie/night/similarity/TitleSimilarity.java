package com.movie.night.similarity;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Edit-distance similarity between movie titles.
 * Titles are reduced to lower-case alphanumerics before comparison, so punctuation,
 * spacing and case never count as edits. Score is {@code 1 - distance / maxLength}.
 */
public class TitleSimilarity {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]");

    /**
     * @return a score between 0.0 (unrelated) and 1.0 (identical); 0.0 when either title is null or empty
     */
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        String a = canonical(s1);
        String b = canonical(s2);
        if (a.equals(b)) {
            return a.isEmpty() ? 0.0 : 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int distance = editDistance(a, b);
        return 1.0 - ((double) distance / Math.max(a.length(), b.length()));
    }

    /**
     * Lower-case alphanumeric form of a title, e.g. {@code "Spider-Man: No Way Home"}
     * becomes {@code "spidermannowayhome"}.
     */
    public static String canonical(String title) {
        return NON_ALPHANUMERIC.matcher(title.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    // Wagner-Fischer with two rolling rows sized to the shorter string.
    private static int editDistance(String s1, String s2) {
        boolean firstShorter = s1.length() <= s2.length();
        String shorter = firstShorter ? s1 : s2;
        String longer = firstShorter ? s2 : s1;

        int[] previous = new int[shorter.length() + 1];
        int[] current = new int[shorter.length() + 1];
        for (int i = 0; i <= shorter.length(); i++) {
            previous[i] = i;
        }

        for (int j = 1; j <= longer.length(); j++) {
            current[0] = j;
            char c = longer.charAt(j - 1);
            for (int i = 1; i <= shorter.length(); i++) {
                int substitution = previous[i - 1] + (shorter.charAt(i - 1) == c ? 0 : 1);
                current[i] = Math.min(Math.min(current[i - 1] + 1, previous[i] + 1), substitution);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[shorter.length()];
    }
}
