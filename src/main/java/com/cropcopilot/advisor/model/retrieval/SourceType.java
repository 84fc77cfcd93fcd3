package com.cropcopilot.advisor.model.retrieval;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Category of the publisher behind a reference passage.
 *
 * <p>Each category carries a fixed authority (credibility) weight used by the
 * hybrid ranker: government &gt; university extension &gt; research paper &gt;
 * manufacturer &gt; other &gt; retailer.
 */
public enum SourceType {
    GOVERNMENT(1.0),
    UNIVERSITY_EXTENSION(0.9),
    RESEARCH_PAPER(0.85),
    MANUFACTURER(0.6),
    RETAILER(0.4),
    OTHER(0.5);

    private final double authorityScore;

    SourceType(double authorityScore) {
        this.authorityScore = authorityScore;
    }

    public double getAuthorityScore() {
        return authorityScore;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Map a stored source type (any case) to an enum constant.
     * Unknown or blank values map to {@link #OTHER}.
     */
    @JsonCreator
    public static SourceType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return OTHER;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (SourceType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return OTHER;
    }
}
