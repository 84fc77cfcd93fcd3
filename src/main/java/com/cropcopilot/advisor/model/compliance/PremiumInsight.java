package com.cropcopilot.advisor.model.compliance;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Compliance insight for one recommendation, as returned by enrichment and
 * persisted alongside it.
 */
@Value
@Builder
public class PremiumInsight {

    public static final String ADVISORY_NOTICE =
            "Decision support only. Verify label instructions, local registrations, and regulations before application.";

    String recommendationId;
    String userId;
    InsightStatus status;

    /**
     * Null unless {@code status} is READY.
     */
    RiskReviewDecision riskReview;

    @Builder.Default
    List<ComplianceCheckResult> checks = List.of();

    @Builder.Default
    String advisoryNotice = ADVISORY_NOTICE;

    String failureReason;
}
