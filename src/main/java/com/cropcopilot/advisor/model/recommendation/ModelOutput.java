package com.cropcopilot.advisor.model.recommendation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Raw, loosely validated JSON object returned by the generative model.
 *
 * <p>Every field may be missing or malformed; {@code OutputNormalizer}
 * resolves each one against the heuristic baseline.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelOutput {

    private RawDiagnosis diagnosis;
    private List<RawRecommendation> recommendations;
    private List<RawProduct> products;
    private Double confidence;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RawDiagnosis {
        private String condition;
        private String conditionType;
        private Double confidence;
        private String reasoning;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RawRecommendation {
        private String action;
        private String priority;
        private String timing;
        private String details;
        private List<String> citations;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RawProduct {
        private String productId;
        private String productName;
        private String reason;
        private String applicationRate;
        private List<String> alternatives;
    }
}
