package com.cropcopilot.advisor.service;

import com.cropcopilot.advisor.model.job.RecommendationEntity;
import com.cropcopilot.advisor.model.recommendation.RecommendationResult;

/**
 * Persistence of finished recommendations and their product plan.
 */
public interface RecommendationResultStore {

    /**
     * Store the result for a job. A result already stored for the same job
     * is replaced, so a redriven job ends with exactly one recommendation.
     */
    RecommendationEntity save(String jobId, String userId, RecommendationResult result);
}
