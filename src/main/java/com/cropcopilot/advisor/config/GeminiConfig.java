package com.cropcopilot.advisor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for the Google Gemini completion service.
 *
 * <p>Properties are loaded from the {@code app.gemini} namespace in application.yml.
 * Example configuration:
 * <pre>
 * app:
 *   gemini:
 *     api-key: ${GEMINI_KEY:}
 *     chat-model: gemini-1.5-flash
 *     json-temperature: 0.2
 *     request-timeout-seconds: 45
 * </pre>
 *
 * <p>With no api key the recommendation pipeline runs heuristic synthesis only.
 */
@ConfigurationProperties(prefix = "app.gemini")
@Data
public class GeminiConfig {

    /**
     * API key for Google Gemini service. Should be set via environment variable GEMINI_KEY.
     */
    private String apiKey;

    private String baseUrl = "https://generativelanguage.googleapis.com";

    private String apiVersion = "v1beta";

    /**
     * Example: "gemini-1.5-flash"
     */
    private String chatModel = "gemini-1.5-flash";

    /**
     * Temperature for JSON output. Lower values keep the schema stable.
     */
    private double jsonTemperature = 0.2;

    private int maxOutputTokens = 1800;

    /**
     * Upper bound on one completion call; past it the heuristic path is used.
     */
    private long requestTimeoutSeconds = 45;

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
