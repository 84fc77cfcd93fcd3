package com.cropcopilot.advisor.model.retrieval;

import lombok.Value;

/**
 * The four independent ranking signals of a candidate, each in [0, 1].
 */
@Value
public class ScoreBreakdown {

    public static final double VECTOR_WEIGHT = 0.55;
    public static final double KEYWORD_WEIGHT = 0.20;
    public static final double AUTHORITY_WEIGHT = 0.15;
    public static final double METADATA_WEIGHT = 0.10;

    double vector;
    double keyword;
    double authority;
    double metadata;

    /**
     * Weighted combination of the four signals. Weights sum to 1, so the
     * result stays in [0, 1].
     */
    public double rankScore() {
        return vector * VECTOR_WEIGHT
                + keyword * KEYWORD_WEIGHT
                + authority * AUTHORITY_WEIGHT
                + metadata * METADATA_WEIGHT;
    }
}
