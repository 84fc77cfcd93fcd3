package com.cropcopilot.advisor.model.retrieval;

import lombok.Value;

/**
 * A retrieved candidate together with its hybrid rank score.
 */
@Value
public class RankedCandidate {

    RetrievedCandidate candidate;
    double rankScore;
    ScoreBreakdown scoreBreakdown;

    public static RankedCandidate of(RetrievedCandidate candidate, ScoreBreakdown breakdown) {
        return new RankedCandidate(candidate, breakdown.rankScore(), breakdown);
    }

    public String getChunkId() {
        return candidate.getChunkId();
    }

    public String getSourceId() {
        return candidate.getSourceId();
    }

    public String getContent() {
        return candidate.getContent();
    }

    public double getSimilarity() {
        return candidate.getSimilarity();
    }

    public SourceType getSourceType() {
        return candidate.getSourceType();
    }

    public String getSourceTitle() {
        return candidate.getSourceTitle();
    }

    public CandidateMetadata getMetadata() {
        return candidate.getMetadata();
    }
}
