package com.cropcopilot.advisor.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Rule set identifiers and the planning thresholds of the risk review.
 * The two thresholds are unit-less policy constants.
 */
@Data
public class ComplianceProperties {

    @NotBlank
    private String ruleVersion = "risk-review-rules-v2";

    @NotBlank
    private String sourceVersion = "heuristic-local-v1-no-regulatory-feed";

    @Positive
    private double maxSingleRate = 10;

    @Positive
    private double maxSeasonalDose = 25000;

    @Min(0)
    private long pastDateGraceHours = 24;

    /**
     * Entitlement answer when no user is listed explicitly.
     */
    private boolean entitledByDefault = false;

    private List<String> entitledUsers = new ArrayList<>();
}
