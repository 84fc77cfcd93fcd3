package com.cropcopilot.advisor.model.corpus;

import com.cropcopilot.advisor.model.retrieval.ImageObservation;
import com.cropcopilot.advisor.model.retrieval.SourceType;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A reference document ready for ingestion: extracted text by section plus
 * the caption-tagged images found in it.
 */
@Value
@Builder
public class ReferenceDocument {
    String sourceId;
    String title;
    SourceType sourceType;
    String institution;
    String url;

    @Builder.Default
    List<String> crops = List.of();

    String region;

    /**
     * Editorial retrieval adjustment for the whole source; null leaves any
     * stored boost unchanged.
     */
    Double sourceBoost;

    @Builder.Default
    List<DocumentSection> sections = List.of();

    @Builder.Default
    List<ImageObservation> images = List.of();
}
