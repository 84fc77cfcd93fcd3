package com.cropcopilot.advisor.model.retrieval;

import lombok.Builder;
import lombok.Value;

/**
 * A reference passage returned by candidate retrieval.
 *
 * <p>Immutable once retrieved. {@code similarity} is already clamped to [0, 1]
 * by the retriever; {@code metadata} is null when the passage has none.
 */
@Value
@Builder(toBuilder = true)
public class RetrievedCandidate {
    String chunkId;
    String sourceId;
    String content;
    double similarity;
    SourceType sourceType;
    String sourceTitle;
    CandidateMetadata metadata;
}
