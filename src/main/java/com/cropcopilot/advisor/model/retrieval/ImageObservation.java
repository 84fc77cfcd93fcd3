package com.cropcopilot.advisor.model.retrieval;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * An image with caption-derived tags and, when it comes from a document,
 * its position among the document's passages.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ImageObservation {
    String imageId;
    String caption;

    @Builder.Default
    List<String> tags = List.of();

    Integer position;
}
