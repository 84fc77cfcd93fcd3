package com.cropcopilot.advisor.model.recommendation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum Priority {
    IMMEDIATE,
    SOON,
    WHEN_CONVENIENT;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Priority> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        for (Priority priority : values()) {
            if (priority.getValue().equals(raw.trim())) {
                return Optional.of(priority);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static Priority fromValue(String raw) {
        return parse(raw).orElse(SOON);
    }
}
