package com.cropcopilot.advisor.model.recommendation;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class Diagnosis {
    String condition;
    ConditionType conditionType;

    /**
     * Always within [0.5, 0.95] after normalization.
     */
    double confidence;

    String reasoning;
}
