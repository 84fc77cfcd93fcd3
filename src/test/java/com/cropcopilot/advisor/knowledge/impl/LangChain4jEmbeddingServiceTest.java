package com.cropcopilot.advisor.knowledge.impl;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("LangChain4j Embedding Service Tests")
class LangChain4jEmbeddingServiceTest {

    @Mock
    private EmbeddingModel embeddingModel;

    @Test
    @DisplayName("Vector of the configured width should be returned")
    void testEmbed_ShouldReturnVectorOfConfiguredWidth() {
        // Given
        LangChain4jEmbeddingService service = new LangChain4jEmbeddingService(embeddingModel, 3);
        when(embeddingModel.embed("nitrogen deficiency in corn"))
                .thenReturn(Response.from(Embedding.from(new float[]{0.1f, 0.2f, 0.3f})));

        // When
        Optional<List<Double>> vector = service.embed("nitrogen deficiency in corn");

        // Then
        assertTrue(vector.isPresent());
        assertEquals(3, vector.get().size());
    }

    @Test
    @DisplayName("Vector from a model of another width should be dropped so retrieval stays lexical")
    void testEmbed_ShouldDropVectorOfOtherWidth() {
        // Given
        LangChain4jEmbeddingService service = new LangChain4jEmbeddingService(embeddingModel, 768);
        when(embeddingModel.embed("gray leaf spot"))
                .thenReturn(Response.from(Embedding.from(new float[1024])));

        // When
        Optional<List<Double>> vector = service.embed("gray leaf spot");

        // Then
        assertTrue(vector.isEmpty());
    }

    @Test
    @DisplayName("Batch with any vector of another width should be dropped")
    void testEmbedAll_ShouldDropBatchWithOtherWidth() {
        // Given
        LangChain4jEmbeddingService service = new LangChain4jEmbeddingService(embeddingModel, 2);
        when(embeddingModel.embedAll(anyList())).thenReturn(Response.from(List.of(
                Embedding.from(new float[]{0.1f, 0.2f}),
                Embedding.from(new float[]{0.1f, 0.2f, 0.3f}))));

        // When
        Optional<List<List<Double>>> vectors = service.embedAll(List.of("first passage", "second passage"));

        // Then
        assertTrue(vectors.isEmpty());
    }

    @Test
    @DisplayName("Service without a model should report disabled and never embed")
    void testEmbed_ShouldStayEmptyWhenDisabled() {
        // Given
        LangChain4jEmbeddingService service = new LangChain4jEmbeddingService(null, 768);

        // When / Then
        assertFalse(service.isEnabled());
        assertTrue(service.embed("anything").isEmpty());
        assertTrue(service.embedAll(List.of("anything")).isEmpty());
        verifyNoInteractions(embeddingModel);
    }
}
