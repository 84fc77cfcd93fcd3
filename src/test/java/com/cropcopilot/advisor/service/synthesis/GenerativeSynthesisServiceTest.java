package com.cropcopilot.advisor.service.synthesis;

import com.cropcopilot.advisor.client.CompletionClient;
import com.cropcopilot.advisor.model.recommendation.GenerationOutcome;
import com.cropcopilot.advisor.model.recommendation.InputSnapshot;
import com.cropcopilot.advisor.model.recommendation.InputType;
import com.cropcopilot.advisor.model.retrieval.QueryExpansionResult;
import com.cropcopilot.advisor.model.retrieval.RankedCandidate;
import com.cropcopilot.advisor.model.retrieval.SourceType;
import com.cropcopilot.advisor.service.PromptLibraryService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static com.cropcopilot.advisor.service.synthesis.HeuristicOutputBuilderTest.ranked;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Generative Synthesis Service Tests")
class GenerativeSynthesisServiceTest {

    @Mock
    private CompletionClient completionClient;

    private GenerativeSynthesisService service;

    private final InputSnapshot input = InputSnapshot.builder()
            .type(InputType.PHOTO)
            .crop("Soybean")
            .description("Interveinal chlorosis")
            .build();

    private final List<RankedCandidate> candidates = List.of(
            ranked("c-1", "Soybean iron chlorosis", SourceType.UNIVERSITY_EXTENSION, 0.8));

    private final QueryExpansionResult expansion =
            new QueryExpansionResult("interveinal chlorosis soybean", List.of("interveinal", "chlorosis", "soybean"));

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        PromptLibraryService promptLibrary = new PromptLibraryService();
        promptLibrary.loadPrompts();
        service = new GenerativeSynthesisService(
                completionClient, promptLibrary, new ModelOutputParser(objectMapper), objectMapper);
    }

    @Test
    @DisplayName("Should be unavailable without calling the model when not configured")
    void testGenerate_NotConfigured() {
        // Given
        when(completionClient.isConfigured()).thenReturn(false);

        // When
        GenerationOutcome outcome = service.generate(input, candidates, expansion);

        // Then
        assertEquals(GenerationOutcome.Status.UNAVAILABLE, outcome.getStatus());
        verify(completionClient, never()).complete(anyString(), anyString());
    }

    @Test
    @DisplayName("Should render evidence into the prompt and parse the reply")
    void testGenerate_ShouldRenderPromptAndParse() {
        // Given
        when(completionClient.isConfigured()).thenReturn(true);
        when(completionClient.modelName()).thenReturn("gemini-1.5-flash");
        when(completionClient.complete(anyString(), anyString()))
                .thenReturn("{\"diagnosis\":{\"condition\":\"iron deficiency\"},\"confidence\":0.7}");

        // When
        GenerationOutcome outcome = service.generate(input, candidates, expansion);

        // Then
        assertTrue(outcome.isOk());
        assertEquals("gemini-1.5-flash", outcome.getModel());
        assertEquals("iron deficiency", outcome.getOutput().getDiagnosis().getCondition());

        ArgumentCaptor<String> system = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> user = ArgumentCaptor.forClass(String.class);
        verify(completionClient).complete(system.capture(), user.capture());
        assertTrue(system.getValue().contains("Use only supplied evidence chunks"));
        assertTrue(user.getValue().contains("chunkId=c-1"));
        assertTrue(user.getValue().contains("sourceType=university_extension"));
        assertTrue(user.getValue().contains("\"crop\":\"Soybean\""), "input JSON must not be HTML-escaped");
    }

    @Test
    @DisplayName("Should report a failing call as unavailable")
    void testGenerate_CallFailure() {
        // Given
        when(completionClient.isConfigured()).thenReturn(true);
        when(completionClient.modelName()).thenReturn("gemini-1.5-flash");
        when(completionClient.complete(anyString(), anyString()))
                .thenThrow(new CompletionClient.CompletionException("timeout"));

        // When
        GenerationOutcome outcome = service.generate(input, candidates, expansion);

        // Then
        assertEquals(GenerationOutcome.Status.UNAVAILABLE, outcome.getStatus());
        assertEquals("timeout", outcome.getReason());
    }

    @Test
    @DisplayName("Should report prose without JSON as invalid")
    void testGenerate_InvalidReply() {
        // Given
        when(completionClient.isConfigured()).thenReturn(true);
        when(completionClient.modelName()).thenReturn("gemini-1.5-flash");
        when(completionClient.complete(anyString(), anyString())).thenReturn("Sorry, I cannot help.");

        // When
        GenerationOutcome outcome = service.generate(input, candidates, expansion);

        // Then
        assertEquals(GenerationOutcome.Status.INVALID, outcome.getStatus());
        assertEquals("gemini-1.5-flash", outcome.getModel());
    }

    @Test
    @DisplayName("Evidence excerpts should be cut to 700 characters")
    void testPromptVariables_ShouldTruncateExcerpts() {
        // Given
        RankedCandidate longCandidate = ranked("c-long", "Long", SourceType.OTHER, 0.4);
        RankedCandidate padded = RankedCandidate.of(
                longCandidate.getCandidate().toBuilder().content("x".repeat(900)).build(),
                longCandidate.getScoreBreakdown());

        // When
        Map<String, Object> variables = service.promptVariables(input, List.of(padded), expansion);

        // Then
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> chunks = (List<Map<String, Object>>) variables.get("chunks");
        String content = (String) chunks.get(0).get("content");
        assertEquals(700, content.length());
        assertTrue(content.endsWith("..."));
        assertEquals("0.400", chunks.get(0).get("similarity"));
    }
}
