package com.cropcopilot.advisor.exception;

import lombok.Getter;

@Getter
public class RecommendationJobNotFoundException extends RuntimeException {

    private final String jobId;

    public RecommendationJobNotFoundException(String jobId) {
        super("Recommendation job not found: " + jobId);
        this.jobId = jobId;
    }
}
