package com.cropcopilot.advisor.model.recommendation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum ConditionType {
    DEFICIENCY,
    DISEASE,
    PEST,
    ENVIRONMENTAL,
    UNKNOWN;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Strict parse of the lowercase wire value; anything else is empty.
     */
    public static Optional<ConditionType> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        for (ConditionType type : values()) {
            if (type.getValue().equals(raw.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static ConditionType fromValue(String raw) {
        return parse(raw).orElse(UNKNOWN);
    }
}
