package com.cropcopilot.advisor.model.recommendation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of observation a grower submitted.
 */
public enum InputType {
    PHOTO,
    LAB_REPORT,
    HYBRID;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static InputType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return InputType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
