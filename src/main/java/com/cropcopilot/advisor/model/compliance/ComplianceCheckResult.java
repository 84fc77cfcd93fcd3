package com.cropcopilot.advisor.model.compliance;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a single compliance rule check. Produced fresh per evaluation.
 */
@Value
@Builder
@Jacksonized
public class ComplianceCheckResult {
    String id;
    String title;
    RiskReviewDecision result;
    CheckSeverity severity;
    String message;
    String ruleVersion;
    String sourceVersion;

    @Builder.Default
    Map<String, Object> evidence = Map.of();

    /**
     * Evidence map that keeps insertion order and tolerates null values
     * (a missing input is itself evidence).
     */
    public static Map<String, Object> evidence(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Evidence requires key/value pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
