package com.cropcopilot.advisor.service.synthesis;

import com.cropcopilot.advisor.client.CompletionClient;
import com.cropcopilot.advisor.exception.ModelOutputParseException;
import com.cropcopilot.advisor.model.prompt.RenderedPrompt;
import com.cropcopilot.advisor.model.recommendation.GenerationOutcome;
import com.cropcopilot.advisor.model.recommendation.InputSnapshot;
import com.cropcopilot.advisor.model.recommendation.ModelOutput;
import com.cropcopilot.advisor.model.retrieval.QueryExpansionResult;
import com.cropcopilot.advisor.model.retrieval.RankedCandidate;
import com.cropcopilot.advisor.service.PromptLibraryService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Asks the generative model for a structured diagnosis grounded in the
 * assembled evidence chunks.
 *
 * <p>Never throws: every failure is folded into a {@link GenerationOutcome}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GenerativeSynthesisService {

    public static final String PROMPT_TEMPLATE = "recommendation";
    static final int MAX_EVIDENCE_CHUNKS = 6;
    static final int MAX_EXCERPT_LENGTH = 700;

    private final CompletionClient completionClient;
    private final PromptLibraryService promptLibrary;
    private final ModelOutputParser parser;
    private final ObjectMapper objectMapper;

    public GenerationOutcome generate(InputSnapshot input,
                                      List<RankedCandidate> candidates,
                                      QueryExpansionResult expansion) {
        if (!completionClient.isConfigured()) {
            return GenerationOutcome.unavailable("completion service not configured");
        }

        String model = completionClient.modelName();
        String raw;
        try {
            RenderedPrompt prompt = promptLibrary.render(PROMPT_TEMPLATE, promptVariables(input, candidates, expansion));
            raw = completionClient.complete(prompt.getSystemPrompt(), prompt.getUserPrompt());
        } catch (RuntimeException e) {
            log.warn("⚠️  Model generation failed, falling back to heuristic output: {}", e.getMessage());
            return GenerationOutcome.unavailable(e.getMessage());
        }

        try {
            ModelOutput output = parser.parse(raw);
            return GenerationOutcome.ok(model, output);
        } catch (ModelOutputParseException e) {
            log.warn("⚠️  Model output from {} was unusable, falling back to heuristic output: {}",
                    model, e.getMessage());
            return GenerationOutcome.invalid(model, e.getMessage());
        }
    }

    Map<String, Object> promptVariables(InputSnapshot input,
                                        List<RankedCandidate> candidates,
                                        QueryExpansionResult expansion) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("inputJson", inputJson(input, expansion));
        variables.put("chunks", candidates.stream()
                .limit(MAX_EVIDENCE_CHUNKS)
                .map(GenerativeSynthesisService::chunkView)
                .collect(Collectors.toList()));
        return variables;
    }

    private String inputJson(InputSnapshot input, QueryExpansionResult expansion) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("type", input.getType() == null ? null : input.getType().getValue());
        view.put("crop", input.getCrop());
        view.put("location", input.getLocation());
        view.put("season", input.getSeason());
        view.put("description", input.getDescription());
        view.put("labData", input.getLabData());
        view.put("query", expansion.getExpandedQuery());
        try {
            return objectMapper.writeValueAsString(view);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize prompt input", e);
        }
    }

    private static Map<String, Object> chunkView(RankedCandidate candidate) {
        String content = candidate.getContent();
        String excerpt = content.length() > MAX_EXCERPT_LENGTH
                ? content.substring(0, MAX_EXCERPT_LENGTH - 3) + "..."
                : content;
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("chunkId", candidate.getChunkId());
        view.put("sourceType", candidate.getSourceType().getValue());
        view.put("sourceTitle", candidate.getSourceTitle());
        view.put("similarity", String.format(Locale.ROOT, "%.3f", candidate.getSimilarity()));
        view.put("content", excerpt);
        return view;
    }
}
