package com.cropcopilot.advisor.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Ollama embedding endpoint. When disabled, retrieval runs lexical only.
 */
@Data
public class EmbeddingProperties {

    private boolean enabled = true;

    @NotBlank
    private String baseUrl = "http://localhost:11434";

    @NotBlank
    private String modelName = "nomic-embed-text";

    /**
     * Vector width of the model. Must equal the {@code vector(n)} width of
     * {@code text_chunk.embedding}.
     */
    @Min(1)
    private int dimension = 768;

    @Min(1)
    private int timeoutSeconds = 30;

    @Min(0)
    private int maxRetries = 1;
}
