package com.cropcopilot.advisor.model.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A recommendation job request as delivered (at least once) by the queue.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class RecommendationJobMessage {
    String messageId;
    String jobId;
    String inputId;
    String userId;
    String traceId;
}
