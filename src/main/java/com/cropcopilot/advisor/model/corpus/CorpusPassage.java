package com.cropcopilot.advisor.model.corpus;

import com.cropcopilot.advisor.model.retrieval.CandidateMetadata;
import lombok.Builder;
import lombok.Value;

/**
 * A chunk row as returned by the corpus store, before retrieval scoring.
 */
@Value
@Builder
public class CorpusPassage {
    String chunkId;
    String sourceId;
    String content;
    String sourceTitle;
    String sourceType;
    String institution;

    /** Raw metadata JSON, kept for substring matching. */
    String rawMetadata;

    /** Parsed metadata; null when absent or malformed. */
    CandidateMetadata metadata;

    double similarity;
    double hybridScore;
    double sourceBoost;
}
