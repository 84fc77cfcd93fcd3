package com.cropcopilot.advisor.model.compliance;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Field context and product plan a compliance evaluation runs over.
 */
@Value
@Builder
public class ComplianceInput {
    String recommendationId;
    String userId;
    String crop;
    String location;
    String season;
    Double fieldAcreage;
    LocalDate plannedApplicationDate;

    @Builder.Default
    List<PlannedProduct> products = List.of();
}
