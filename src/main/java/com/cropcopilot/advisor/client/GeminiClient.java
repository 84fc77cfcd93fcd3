package com.cropcopilot.advisor.client;

import com.cropcopilot.advisor.config.GeminiConfig;
import com.cropcopilot.advisor.model.CallContext;
import com.cropcopilot.advisor.model.ServiceType;
import com.cropcopilot.advisor.util.ExternalCallLogger;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Google Gemini {@code generateContent} client.
 *
 * No retry: a failed or slow call is reported once and the caller falls
 * back to heuristic synthesis. The request timeout is the only timeout.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GeminiClient implements CompletionClient {

    private final GeminiConfig geminiConfig;
    private final ObjectMapper objectMapper;

    private WebClient geminiWebClient;

    @PostConstruct
    public void init() {
        // API key travels in a header so it never shows up in access logs
        this.geminiWebClient = WebClient.builder()
                .baseUrl(geminiConfig.getBaseUrl())
                .defaultHeader("x-goog-api-key", geminiConfig.getApiKey() == null ? "" : geminiConfig.getApiKey())
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                        .build())
                .build();
        log.info("🔴 Gemini client ready (model: {}, configured: {})",
                geminiConfig.getChatModel(), geminiConfig.isConfigured());
    }

    @Override
    public boolean isConfigured() {
        return geminiConfig.isConfigured();
    }

    @Override
    public String modelName() {
        return geminiConfig.getChatModel();
    }

    private String getApiUrl(String model, String action) {
        return String.format("/%s/models/%s:%s", geminiConfig.getApiVersion(), model, action);
    }

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        if (!isConfigured()) {
            throw new CompletionException("Gemini api key is not configured");
        }

        String model = geminiConfig.getChatModel();
        Map<String, Object> body = Map.of(
                "systemInstruction", Map.of("parts", List.of(Map.of("text", systemPrompt))),
                "contents", List.of(Map.of("role", "user", "parts", List.of(Map.of("text", userPrompt)))),
                "generationConfig", Map.of(
                        "responseMimeType", "application/json",
                        "temperature", geminiConfig.getJsonTemperature(),
                        "maxOutputTokens", geminiConfig.getMaxOutputTokens()));

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.GEMINI, "generateContent", log);
        ctx.logRequest(ExternalCallLogger.truncate(userPrompt, 200),
                "Model", model,
                "Prompt length", userPrompt.length());

        try {
            String json = geminiWebClient.post()
                    .uri(getApiUrl(model, "generateContent"))
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(geminiConfig.getRequestTimeoutSeconds()))
                    .block();

            String text = extractText(json);
            ctx.logResponse(ExternalCallLogger.truncate(text, 200), "Response length", text.length());
            return text;
        } catch (WebClientResponseException e) {
            ctx.logError("HTTP " + e.getStatusCode().value(), e);
            throw new CompletionException("Gemini request failed (" + e.getStatusCode().value() + "): "
                    + ExternalCallLogger.truncate(e.getResponseBodyAsString(), 180), e);
        } catch (CompletionException e) {
            ctx.logError(e.getMessage(), e);
            throw e;
        } catch (RuntimeException e) {
            ctx.logError(e.getMessage(), e);
            throw new CompletionException("Gemini request failed: " + e.getMessage(), e);
        }
    }

    private String extractText(String rawJson) {
        if (rawJson == null || rawJson.isBlank()) {
            throw new CompletionException("Gemini returned an empty body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(rawJson);
        } catch (JsonProcessingException e) {
            throw new CompletionException("Gemini returned malformed JSON", e);
        }
        JsonNode text = root.path("candidates").path(0).path("content").path("parts").path(0).path("text");
        if (!text.isTextual() || text.asText().isBlank()) {
            throw new CompletionException("Gemini response did not include a text part");
        }
        return text.asText();
    }
}
