package com.cropcopilot.advisor.model.recommendation;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class SourceReference {
    String chunkId;
    double relevance;
    String excerpt;
}
