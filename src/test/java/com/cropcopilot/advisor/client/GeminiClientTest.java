package com.cropcopilot.advisor.client;

import com.cropcopilot.advisor.config.GeminiConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GeminiClient against a local stand-in for the generateContent endpoint.
 *
 * The live test at the bottom REQUIRES: GEMINI_KEY environment variable
 */
@DisplayName("Gemini Client Tests")
class GeminiClientTest {

    private static final String MODEL_PATH = "/v1beta/models/gemini-1.5-flash:generateContent";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<String> lastPath = new AtomicReference<>();
    private final AtomicReference<String> lastApiKey = new AtomicReference<>();
    private final AtomicReference<String> lastBody = new AtomicReference<>();

    private HttpServer server;
    private int status;
    private String responseBody;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            lastPath.set(exchange.getRequestURI().getPath());
            lastApiKey.set(exchange.getRequestHeaders().getFirst("x-goog-api-key"));
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    @DisplayName("Should return the first text part of a JSON-mode completion")
    void testComplete_ShouldReturnText() throws Exception {
        // Given
        status = 200;
        responseBody = "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"{\\\"diagnosis\\\":{}}\"}]}}]}";
        GeminiClient client = client("test-key");

        // When
        String text = client.complete("You are an agronomist.", "Gray lesions on corn leaves");

        // Then
        assertEquals("{\"diagnosis\":{}}", text);
        assertEquals(MODEL_PATH, lastPath.get());
        assertEquals("test-key", lastApiKey.get());

        JsonNode request = objectMapper.readTree(lastBody.get());
        assertEquals("application/json", request.at("/generationConfig/responseMimeType").asText());
        assertEquals("You are an agronomist.", request.at("/systemInstruction/parts/0/text").asText());
        assertEquals("Gray lesions on corn leaves", request.at("/contents/0/parts/0/text").asText());
    }

    @Test
    @DisplayName("HTTP errors should surface as CompletionException with the status")
    void testComplete_HttpErrorShouldThrow() {
        // Given
        status = 500;
        responseBody = "{\"error\":{\"message\":\"backend overloaded\"}}";
        GeminiClient client = client("test-key");

        // When
        CompletionClient.CompletionException error = assertThrows(CompletionClient.CompletionException.class,
                () -> client.complete("system", "user"));

        // Then
        assertTrue(error.getMessage().contains("(500)"), error.getMessage());
    }

    @Test
    @DisplayName("Reply without a text part should be rejected")
    void testComplete_MissingTextShouldThrow() {
        status = 200;
        responseBody = "{\"candidates\":[{\"finishReason\":\"SAFETY\"}]}";
        GeminiClient client = client("test-key");

        assertThrows(CompletionClient.CompletionException.class, () -> client.complete("system", "user"));
    }

    @Test
    @DisplayName("Client without api key should report itself unconfigured and refuse to call")
    void testComplete_NotConfigured() {
        responseBody = "{}";
        GeminiClient client = client(" ");

        assertFalse(client.isConfigured());
        assertThrows(CompletionClient.CompletionException.class, () -> client.complete("system", "user"));
        assertNull(lastPath.get(), "No request should reach the endpoint");
    }

    @Test
    @DisplayName("Live completion should return JSON text")
    @EnabledIfEnvironmentVariable(named = "GEMINI_KEY", matches = ".+")
    void testComplete_Live() throws Exception {
        // Given
        GeminiConfig config = new GeminiConfig();
        config.setApiKey(System.getenv("GEMINI_KEY"));
        GeminiClient client = new GeminiClient(config, objectMapper);
        client.init();

        // When
        String text = client.complete("Reply with a JSON object only.",
                "Return {\"crop\": \"corn\"} and nothing else.");

        // Then
        assertTrue(objectMapper.readTree(text).isObject());
        System.out.println("✅ Live completion: " + text);
    }

    private GeminiClient client(String apiKey) {
        GeminiConfig config = new GeminiConfig();
        config.setApiKey(apiKey);
        config.setBaseUrl("http://127.0.0.1:" + server.getAddress().getPort());
        config.setRequestTimeoutSeconds(5);
        GeminiClient client = new GeminiClient(config, objectMapper);
        client.init();
        return client;
    }
}
