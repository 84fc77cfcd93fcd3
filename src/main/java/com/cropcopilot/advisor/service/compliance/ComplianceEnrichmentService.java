package com.cropcopilot.advisor.service.compliance;

import com.cropcopilot.advisor.model.compliance.ComplianceEvaluation;
import com.cropcopilot.advisor.model.compliance.ComplianceInput;
import com.cropcopilot.advisor.model.compliance.InsightStatus;
import com.cropcopilot.advisor.model.compliance.PremiumInsight;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Compliance review stage, run after a recommendation has been stored.
 *
 * <p>Every call leaves exactly one insight row for the recommendation:
 * {@code NOT_AVAILABLE} for users without entitlement, {@code FAILED} when
 * the recommendation cannot be found or evaluation fails, otherwise
 * {@code PROCESSING} followed by {@code READY} with the checks. The check
 * set is replaced on every run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ComplianceEnrichmentService {

    static final String RECOMMENDATION_NOT_FOUND = "Recommendation not found for premium enrichment";

    private final EntitlementService entitlementService;
    private final ComplianceDataStore dataStore;
    private final ComplianceRiskEvaluator evaluator;
    private final Clock clock;

    public PremiumInsight enrich(String recommendationId, String userId) {
        Objects.requireNonNull(recommendationId, "recommendationId is required");
        Objects.requireNonNull(userId, "userId is required");

        if (!entitlementService.isEntitled(userId)) {
            log.info("🔒 User {} not entitled to compliance review of {}", userId, recommendationId);
            return save(PremiumInsight.builder()
                    .recommendationId(recommendationId)
                    .userId(userId)
                    .status(InsightStatus.NOT_AVAILABLE)
                    .build());
        }

        Optional<ComplianceInput> input = dataStore.loadInput(recommendationId, userId);
        if (input.isEmpty()) {
            log.warn("⚠️  {}: {}", RECOMMENDATION_NOT_FOUND, recommendationId);
            return save(PremiumInsight.builder()
                    .recommendationId(recommendationId)
                    .userId(userId)
                    .status(InsightStatus.FAILED)
                    .failureReason(RECOMMENDATION_NOT_FOUND)
                    .build());
        }

        save(PremiumInsight.builder()
                .recommendationId(recommendationId)
                .userId(userId)
                .status(InsightStatus.PROCESSING)
                .build());

        try {
            ComplianceEvaluation evaluation = evaluator.evaluate(input.get(), clock.instant());
            dataStore.replaceAuditLog(input.get(), evaluation);

            log.info("🛡️  Compliance review of {} finished: {} ({} checks)",
                    recommendationId, evaluation.getRiskReview().getValue(), evaluation.getChecks().size());
            return save(PremiumInsight.builder()
                    .recommendationId(recommendationId)
                    .userId(userId)
                    .status(InsightStatus.READY)
                    .riskReview(evaluation.getRiskReview())
                    .checks(evaluation.getChecks())
                    .build());
        } catch (RuntimeException e) {
            log.error("❌ Compliance review of {} failed: {}", recommendationId, e.getMessage(), e);
            save(PremiumInsight.builder()
                    .recommendationId(recommendationId)
                    .userId(userId)
                    .status(InsightStatus.FAILED)
                    .failureReason(e.getMessage())
                    .build());
            throw e;
        }
    }

    private PremiumInsight save(PremiumInsight insight) {
        dataStore.saveInsight(insight);
        return insight;
    }
}
