package com.cropcopilot.advisor.model.retrieval;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Request-side signals the hybrid ranker scores candidates against.
 */
@Value
@Builder
public class RankContext {

    @Builder.Default
    List<String> queryTerms = List.of();

    String crop;

    String region;

    @Builder.Default
    List<String> topicHints = List.of();
}
