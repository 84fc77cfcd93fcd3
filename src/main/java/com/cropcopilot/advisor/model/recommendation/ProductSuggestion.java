package com.cropcopilot.advisor.model.recommendation;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class ProductSuggestion {
    String productId;

    /**
     * Display name as the model wrote it; matched against the catalog when the id is unknown.
     */
    String productName;

    String reason;
    String applicationRate;

    @Builder.Default
    List<String> alternatives = List.of();
}
