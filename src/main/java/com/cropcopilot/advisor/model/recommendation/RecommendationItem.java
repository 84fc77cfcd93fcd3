package com.cropcopilot.advisor.model.recommendation;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * One recommended action. After normalization {@code citations} holds 1 to 3
 * distinct chunk ids, each present in the assembled context.
 */
@Value
@Builder
@Jacksonized
public class RecommendationItem {
    String action;
    Priority priority;
    String timing;
    String details;

    @Builder.Default
    List<String> citations = List.of();
}
