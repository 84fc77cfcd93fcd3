package com.cropcopilot.advisor.model;

/**
 * Enumeration of external service types for unified logging.
 *
 * Used by ExternalCallLogger to categorize and log calls to
 * different external services with consistent formatting.
 *
 * @see com.cropcopilot.advisor.util.ExternalCallLogger
 */
public enum ServiceType {
    OLLAMA("🟣", "Ollama"),
    GEMINI("🔴", "Gemini"),
    POSTGRES("🐘", "Postgres");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
