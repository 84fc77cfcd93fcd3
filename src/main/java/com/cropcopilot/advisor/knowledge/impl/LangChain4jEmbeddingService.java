package com.cropcopilot.advisor.knowledge.impl;

import com.cropcopilot.advisor.configuration.AppProperties;
import com.cropcopilot.advisor.configuration.EmbeddingProperties;
import com.cropcopilot.advisor.knowledge.EmbeddingService;
import com.cropcopilot.advisor.model.CallContext;
import com.cropcopilot.advisor.model.ServiceType;
import com.cropcopilot.advisor.util.ExternalCallLogger;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * LangChain4j embedding service backed by an Ollama embedding model.
 *
 * Retries and timeouts are delegated to {@link OllamaEmbeddingModel}; once
 * those are exhausted the failure is logged and reported as empty.
 */
@Slf4j
@Service
public class LangChain4jEmbeddingService implements EmbeddingService {

    private final EmbeddingModel embeddingModel;
    private final boolean enabled;
    private final int dimension;

    @Autowired
    public LangChain4jEmbeddingService(AppProperties props) {
        EmbeddingProperties embedding = props.getEmbedding();
        this.enabled = embedding.isEnabled();
        this.dimension = embedding.getDimension();

        log.info("🔷 Initializing LangChain4j Embedding Service");
        log.info("   - Enabled: {}", enabled);
        log.info("   - Ollama URL: {}", embedding.getBaseUrl());
        log.info("   - Model: {} ({} dimensions)", embedding.getModelName(), dimension);
        log.info("   - Timeout: {}s", embedding.getTimeoutSeconds());
        log.info("   - Max Retries: {}", embedding.getMaxRetries());

        this.embeddingModel = enabled
                ? OllamaEmbeddingModel.builder()
                        .baseUrl(embedding.getBaseUrl())
                        .modelName(embedding.getModelName())
                        .timeout(Duration.ofSeconds(embedding.getTimeoutSeconds()))
                        .maxRetries(embedding.getMaxRetries())
                        .logRequests(false)
                        .logResponses(false)
                        .build()
                : null;
    }

    LangChain4jEmbeddingService(EmbeddingModel embeddingModel, int dimension) {
        this.embeddingModel = embeddingModel;
        this.enabled = embeddingModel != null;
        this.dimension = dimension;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public Optional<List<Double>> embed(String text) {
        if (!enabled) {
            return Optional.empty();
        }
        if (text == null || text.isBlank()) {
            log.warn("⚠️  Refusing to embed blank text");
            return Optional.empty();
        }

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.OLLAMA, "embed", log);
        ctx.logRequest(ExternalCallLogger.truncate(text, 120), "Length", text.length());
        try {
            Response<Embedding> response = embeddingModel.embed(text);
            List<Double> vector = convertToDoubleList(response.content());
            if (vector.isEmpty() || vector.stream().anyMatch(v -> !Double.isFinite(v))) {
                ctx.logDegraded("embedding payload was empty or non-numeric");
                return Optional.empty();
            }
            if (vector.size() != dimension) {
                ctx.logDegraded("expected " + dimension + " dimensions, got " + vector.size());
                return Optional.empty();
            }
            ctx.logResponse(vector.size() + " dimensions");
            return Optional.of(vector);
        } catch (RuntimeException e) {
            ctx.logDegraded(e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<List<List<Double>>> embedAll(List<String> texts) {
        if (!enabled || texts == null || texts.isEmpty()) {
            return Optional.empty();
        }

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.OLLAMA, "embedAll", log);
        ctx.logRequest(texts.size() + " texts");
        try {
            List<TextSegment> segments = texts.stream()
                    .map(TextSegment::from)
                    .collect(Collectors.toList());
            Response<List<Embedding>> response = embeddingModel.embedAll(segments);
            List<List<Double>> vectors = response.content().stream()
                    .map(this::convertToDoubleList)
                    .collect(Collectors.toList());
            if (vectors.size() != texts.size()) {
                ctx.logDegraded("expected " + texts.size() + " vectors, got " + vectors.size());
                return Optional.empty();
            }
            if (vectors.stream().anyMatch(vector -> vector.size() != dimension)) {
                ctx.logDegraded("vector width differs from the configured " + dimension + " dimensions");
                return Optional.empty();
            }
            ctx.logResponse(vectors.size() + " embeddings");
            return Optional.of(vectors);
        } catch (RuntimeException e) {
            ctx.logDegraded(e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Convert LangChain4j Embedding (float[]) to List<Double>.
     */
    private List<Double> convertToDoubleList(Embedding embedding) {
        float[] vector = embedding.vector();
        List<Double> result = new ArrayList<>(vector.length);
        for (float value : vector) {
            result.add((double) value);
        }
        return result;
    }
}
