package com.cropcopilot.advisor.model.job;

import lombok.Value;

/**
 * Published once a job's recommendation has been stored.
 */
@Value
public class RecommendationCompletedEvent {
    String recommendationId;
    String userId;
    String jobId;
    String traceId;
}
