package com.cropcopilot.advisor.util;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Small string and number helpers shared by retrieval and synthesis.
 */
public final class TextNormalizer {

    private TextNormalizer() {
    }

    /**
     * Collapse runs of whitespace to single spaces and trim.
     */
    public static String normalizeWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return text.replaceAll("\\s+", " ").trim();
    }

    /**
     * Trimmed value, or empty when null or blank.
     */
    public static Optional<String> nonBlank(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
    }

    public static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    public static List<String> lowerAll(Collection<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(v -> v != null)
                .map(TextNormalizer::lower)
                .collect(Collectors.toList());
    }

    /**
     * Clamp into [min, max]; non-finite values map to {@code min}.
     */
    public static double clamp(double value, double min, double max) {
        if (!Double.isFinite(value)) {
            return min;
        }
        return Math.min(max, Math.max(min, value));
    }
}
