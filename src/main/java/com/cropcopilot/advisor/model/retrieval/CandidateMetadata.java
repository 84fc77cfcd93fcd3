package com.cropcopilot.advisor.model.retrieval;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Typed metadata stored alongside a reference passage.
 *
 * <p>Every field is independently optional. List getters never return null
 * when built through the builder; Jackson may still leave them null when the
 * stored JSON carries an explicit {@code null}, so consumers go through the
 * {@code *OrEmpty()} helpers.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class CandidateMetadata {

    @Builder.Default
    List<String> crops = List.of();

    @Builder.Default
    List<String> topics = List.of();

    String region;

    @Builder.Default
    List<String> tags = List.of();

    /**
     * Ordinal position of the passage inside its source document.
     */
    Integer position;

    String updatedAt;

    public List<String> cropsOrEmpty() {
        return crops != null ? crops : List.of();
    }

    public List<String> topicsOrEmpty() {
        return topics != null ? topics : List.of();
    }

    public List<String> tagsOrEmpty() {
        return tags != null ? tags : List.of();
    }
}
