package com.cropcopilot.advisor.model.recommendation;

import lombok.Value;

import java.util.Objects;

/**
 * Identifiers of one pipeline run. All three are required.
 */
@Value
public class RecommendationRequest {
    String inputId;
    String userId;
    String jobId;

    public RecommendationRequest(String inputId, String userId, String jobId) {
        this.inputId = requireId(inputId, "inputId");
        this.userId = requireId(userId, "userId");
        this.jobId = requireId(jobId, "jobId");
    }

    private static String requireId(String value, String name) {
        Objects.requireNonNull(value, name + " is required");
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }
}
