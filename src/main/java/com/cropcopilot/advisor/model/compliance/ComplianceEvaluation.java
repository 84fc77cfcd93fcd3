package com.cropcopilot.advisor.model.compliance;

import lombok.Value;

import java.util.List;

@Value
public class ComplianceEvaluation {
    List<ComplianceCheckResult> checks;
    RiskReviewDecision riskReview;
}
