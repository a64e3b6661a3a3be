package com.movie.night.identity;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient field readers shared by the fingerprint normalizers and payload parsers.
 * Every reader returns null for missing, placeholder or malformed input instead of throwing.
 */
public final class FieldParsers {

    private static final Pattern MINUTES = Pattern.compile("(\\d+)\\s*min", Pattern.CASE_INSENSITIVE);
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private FieldParsers() {
    }

    /**
     * Reads a trimmed text field. {@code "N/A"} (OMDb) and {@code "\N"} (IMDb datasets)
     * are treated as missing, as are blank strings.
     */
    public static String text(JsonNode payload, String field) {
        if (payload == null || !payload.isObject()) {
            return null;
        }
        JsonNode node = payload.get(field);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String value = node.asText().trim();
        if (value.isEmpty() || "N/A".equalsIgnoreCase(value) || "\\N".equals(value)) {
            return null;
        }
        return value;
    }

    /**
     * Reads a runtime in minutes. Integral numbers pass through; strings must look like
     * {@code "142 min"} or be a bare integer. Zero or negative runtimes count as unknown.
     */
    public static Integer runtimeMinutes(JsonNode payload, String field) {
        if (payload == null || !payload.isObject()) {
            return null;
        }
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        Integer minutes = null;
        if (node.isIntegralNumber()) {
            minutes = node.intValue();
        } else if (node.isTextual()) {
            minutes = parseMinutes(node.asText());
        }
        return minutes != null && minutes > 0 ? minutes : null;
    }

    /**
     * Parses {@code "142 min"} or {@code "142"}; returns null otherwise.
     */
    public static Integer parseMinutes(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        Matcher matcher = MINUTES.matcher(trimmed);
        if (matcher.find()) {
            return safeInt(matcher.group(1));
        }
        if (DIGITS.matcher(trimmed).matches()) {
            return safeInt(trimmed);
        }
        return null;
    }

    /**
     * Reads a year from an integral field or from the first four characters of a
     * string such as {@code "2010"} or {@code "2010-06-18"}.
     */
    public static Integer year(JsonNode payload, String field) {
        if (payload == null || !payload.isObject()) {
            return null;
        }
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            int value = node.intValue();
            return value > 0 ? value : null;
        }
        return parseYear(text(payload, field));
    }

    /**
     * Parses the leading four characters of a string as a year.
     */
    public static Integer parseYear(String raw) {
        if (raw == null || raw.length() < 4) {
            return null;
        }
        String head = raw.substring(0, 4);
        if (!DIGITS.matcher(head).matches()) {
            return null;
        }
        int value = Integer.parseInt(head);
        return value > 0 ? value : null;
    }

    private static Integer safeInt(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            // More digits than an int holds: not a runtime.
            return null;
        }
    }
}
