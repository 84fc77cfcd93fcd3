package com.cropcopilot.advisor.knowledge;

import java.util.List;
import java.util.Optional;

/**
 * Text embedding for corpus search and ingestion.
 *
 * Implementations never throw on service failure: an unreachable, disabled
 * or misbehaving embedding backend is reported as an empty result so that
 * callers can fall back to lexical retrieval.
 */
public interface EmbeddingService {

    /**
     * @return false when embeddings are switched off by configuration
     */
    boolean isEnabled();

    /**
     * Embed a single text (typically an expanded search query).
     *
     * @param text the text to embed
     * @return the vector, or empty when the service is disabled or failed
     */
    Optional<List<Double>> embed(String text);

    /**
     * Embed several texts in one call, same order as input.
     *
     * @return the vectors, or empty when the service is disabled or failed
     */
    Optional<List<List<Double>>> embedAll(List<String> texts);
}
