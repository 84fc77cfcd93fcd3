package com.cropcopilot.advisor.model.recommendation;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Structured diagnosis produced by synthesis, either normalized model output
 * or the deterministic heuristic baseline.
 */
@Value
@Builder
public class SynthesizedOutput {
    Diagnosis diagnosis;

    @Builder.Default
    List<RecommendationItem> recommendations = List.of();

    @Builder.Default
    List<ProductSuggestion> products = List.of();

    double confidence;
}
