package com.cropcopilot.advisor.model.retrieval;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Link between an image observation and the passage it best supports.
 * {@code linkedChunkId} is null and {@code score} is 0 when nothing matched.
 */
@Value
@Builder
@Jacksonized
public class ImageLinkResult {
    String imageId;
    String linkedChunkId;
    double score;
}
