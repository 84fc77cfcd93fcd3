package com.cropcopilot.advisor.model.recommendation;

import com.cropcopilot.advisor.model.retrieval.ImageLinkResult;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Synthesized output plus generation metadata, embedded in a
 * {@link RecommendationResult}.
 */
@Value
@Builder
@Jacksonized
public class DiagnosisPayload {
    Diagnosis diagnosis;

    @Builder.Default
    List<RecommendationItem> recommendations = List.of();

    @Builder.Default
    List<ProductSuggestion> products = List.of();

    double confidence;

    /**
     * ISO-8601 instant.
     */
    String generatedAt;

    String inputId;
    String userId;
    String jobId;
    String retrievalQuery;

    @Builder.Default
    List<ImageLinkResult> imageLinks = List.of();
}
