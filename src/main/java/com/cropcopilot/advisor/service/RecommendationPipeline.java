package com.cropcopilot.advisor.service;

import com.cropcopilot.advisor.model.recommendation.RecommendationRequest;
import com.cropcopilot.advisor.model.recommendation.RecommendationResult;

/**
 * Turns one grower input into a cited recommendation.
 *
 * <p>Retrieval, ranking, generation (with heuristic fallback), normalization,
 * citation collection and the retrieval audit all happen inside
 * {@link #run(RecommendationRequest)}. Persisting the result is left to the caller.
 */
public interface RecommendationPipeline {

    /**
     * Model name reported when the generative step did not contribute.
     */
    String HEURISTIC_MODEL = "heuristic-rag-v1";

    /**
     * @throws com.cropcopilot.advisor.exception.InputNotFoundException if the
     *         input does not exist for the user
     */
    RecommendationResult run(RecommendationRequest request);
}
