package com.cropcopilot.advisor.model.compliance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Locale;

/**
 * Outcome of a compliance check, and of the aggregate risk review.
 *
 * <p>Ordered by severity: {@code POTENTIAL_CONFLICT} &gt;
 * {@code NEEDS_MANUAL_VERIFICATION} &gt; {@code CLEAR_SIGNAL}.
 */
public enum RiskReviewDecision {
    CLEAR_SIGNAL(0),
    NEEDS_MANUAL_VERIFICATION(1),
    POTENTIAL_CONFLICT(2);

    private final int severityRank;

    RiskReviewDecision(int severityRank) {
        this.severityRank = severityRank;
    }

    public int getSeverityRank() {
        return severityRank;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RiskReviewDecision fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return RiskReviewDecision.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Most severe decision in the collection; {@code CLEAR_SIGNAL} when empty.
     */
    public static RiskReviewDecision mostSevere(Collection<RiskReviewDecision> decisions) {
        RiskReviewDecision worst = CLEAR_SIGNAL;
        for (RiskReviewDecision decision : decisions) {
            if (decision != null && decision.severityRank > worst.severityRank) {
                worst = decision;
            }
        }
        return worst;
    }
}
