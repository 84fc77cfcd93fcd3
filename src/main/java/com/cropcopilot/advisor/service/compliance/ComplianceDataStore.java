package com.cropcopilot.advisor.service.compliance;

import com.cropcopilot.advisor.model.compliance.ComplianceEvaluation;
import com.cropcopilot.advisor.model.compliance.ComplianceInput;
import com.cropcopilot.advisor.model.compliance.PremiumInsight;

import java.util.Optional;

/**
 * Field and product-plan context in, check results and insights out.
 */
public interface ComplianceDataStore {

    /**
     * @return empty when the recommendation does not exist for the user
     */
    Optional<ComplianceInput> loadInput(String recommendationId, String userId);

    /**
     * Replace the stored check set for the recommendation with {@code evaluation}.
     */
    void replaceAuditLog(ComplianceInput input, ComplianceEvaluation evaluation);

    /**
     * Insert or overwrite the single insight row of a recommendation.
     */
    void saveInsight(PremiumInsight insight);

    Optional<PremiumInsight> findInsight(String recommendationId, String userId);
}
