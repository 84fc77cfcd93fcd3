package com.cropcopilot.advisor.model.compliance;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CheckSeverity {
    HARD,
    SOFT;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
