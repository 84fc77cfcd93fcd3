package com.cropcopilot.advisor.model.audit;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One assembled candidate as written to the retrieval audit.
 */
@Value
@Builder
@Jacksonized
public class AuditedChunk {
    String id;
    String sourceId;
    double similarity;
    double rankScore;
    String sourceType;
    boolean cited;
    boolean assembled;
    String type;
}
