package com.cropcopilot.advisor.model.recommendation;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Final product of one pipeline run. Created once, never mutated.
 */
@Value
@Builder
@Jacksonized
public class RecommendationResult {
    String recommendationId;
    double confidence;
    DiagnosisPayload diagnosis;

    @Builder.Default
    List<SourceReference> sources = List.of();

    String modelUsed;
}
