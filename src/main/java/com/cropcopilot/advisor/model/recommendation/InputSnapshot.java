package com.cropcopilot.advisor.model.recommendation;

import com.cropcopilot.advisor.model.retrieval.ImageObservation;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of a grower's submission, as loaded from intake.
 *
 * <p>All fields except {@code type} are optional.
 */
@Value
@Builder
public class InputSnapshot {
    InputType type;
    String imageUrl;
    String crop;
    String location;
    String season;
    String description;

    /**
     * Lab values keyed by analyte, e.g. {@code "nitrogen_ppm" -> 12.0}.
     */
    Map<String, Double> labData;

    /**
     * Caption-derived observations for any images attached to the input.
     */
    @Builder.Default
    List<ImageObservation> imageObservations = List.of();
}
