package com.cropcopilot.advisor.model.audit;

import com.cropcopilot.advisor.model.retrieval.ImageLinkResult;
import com.cropcopilot.advisor.model.retrieval.RankedCandidate;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything the retrieval audit needs to know about one pipeline run.
 */
@Value
@Builder
public class RetrievalAuditRecord {
    String inputId;
    String recommendationId;
    String query;

    @Builder.Default
    List<String> queryTerms = List.of();

    /**
     * The assembled context candidates, in rank order.
     */
    @Builder.Default
    List<RankedCandidate> candidates = List.of();

    @Builder.Default
    List<String> citedChunkIds = List.of();

    @Builder.Default
    List<ImageLinkResult> imageLinks = List.of();
}
