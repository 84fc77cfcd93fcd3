package com.cropcopilot.advisor.service.impl;

import com.cropcopilot.advisor.configuration.AppProperties;
import com.cropcopilot.advisor.configuration.RetrievalProperties;
import com.cropcopilot.advisor.exception.InputNotFoundException;
import com.cropcopilot.advisor.model.audit.RetrievalAuditRecord;
import com.cropcopilot.advisor.model.recommendation.DiagnosisPayload;
import com.cropcopilot.advisor.model.recommendation.GenerationOutcome;
import com.cropcopilot.advisor.model.recommendation.InputSnapshot;
import com.cropcopilot.advisor.model.recommendation.RecommendationItem;
import com.cropcopilot.advisor.model.recommendation.RecommendationRequest;
import com.cropcopilot.advisor.model.recommendation.RecommendationResult;
import com.cropcopilot.advisor.model.recommendation.SourceReference;
import com.cropcopilot.advisor.model.recommendation.SynthesizedOutput;
import com.cropcopilot.advisor.model.retrieval.ImageLinkResult;
import com.cropcopilot.advisor.model.retrieval.QueryExpansionResult;
import com.cropcopilot.advisor.model.retrieval.RankContext;
import com.cropcopilot.advisor.model.retrieval.RankedCandidate;
import com.cropcopilot.advisor.model.retrieval.RetrievedCandidate;
import com.cropcopilot.advisor.query.CandidateRetriever;
import com.cropcopilot.advisor.query.QueryExpander;
import com.cropcopilot.advisor.search.HybridRanker;
import com.cropcopilot.advisor.search.MmrDiversifier;
import com.cropcopilot.advisor.search.MultimodalLinker;
import com.cropcopilot.advisor.service.InputSnapshotService;
import com.cropcopilot.advisor.service.RecommendationPipeline;
import com.cropcopilot.advisor.service.RetrievalAuditService;
import com.cropcopilot.advisor.service.synthesis.GenerativeSynthesisService;
import com.cropcopilot.advisor.service.synthesis.HeuristicOutputBuilder;
import com.cropcopilot.advisor.service.synthesis.OutputNormalizer;
import com.cropcopilot.advisor.util.TextNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class RecommendationPipelineImpl implements RecommendationPipeline {

    static final int MAX_CITED_SOURCES = 4;
    static final int EXCERPT_LENGTH = 300;

    private final InputSnapshotService inputSnapshotService;
    private final QueryExpander queryExpander;
    private final CandidateRetriever candidateRetriever;
    private final HybridRanker ranker;
    private final MmrDiversifier diversifier;
    private final MultimodalLinker imageLinker;
    private final GenerativeSynthesisService synthesisService;
    private final HeuristicOutputBuilder heuristicBuilder;
    private final OutputNormalizer normalizer;
    private final RetrievalAuditService auditService;
    private final AppProperties props;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public RecommendationResult run(RecommendationRequest request) {
        long start = System.currentTimeMillis();
        log.info("🌱 Running recommendation pipeline for input {} (job {})", request.getInputId(), request.getJobId());

        InputSnapshot input = inputSnapshotService.load(request.getInputId(), request.getUserId())
                .orElseThrow(() -> new InputNotFoundException(request.getInputId()));

        String retrievalQuery = buildRetrievalQuery(input);
        QueryExpansionResult expansion = queryExpander.expand(
                retrievalQuery, input.getCrop(), input.getLocation(), input.getSeason());

        List<RetrievedCandidate> candidates = candidateRetriever.retrieve(expansion, input.getCrop());
        List<RankedCandidate> ranked = ranker.rank(candidates, RankContext.builder()
                .queryTerms(expansion.getTerms())
                .crop(input.getCrop())
                .region(input.getLocation())
                .build());
        List<RankedCandidate> context = selectContext(ranked);
        log.info("📚 {} candidates retrieved, {} assembled into context", candidates.size(), context.size());

        GenerationOutcome outcome = synthesisService.generate(input, context, expansion);
        SynthesizedOutput heuristic = heuristicBuilder.build(input, context);
        SynthesizedOutput normalized = normalizer.normalize(outcome, heuristic, context);

        List<String> citedChunkIds = collectCitations(normalized.getRecommendations(), context);
        List<SourceReference> sources = buildSources(citedChunkIds, context);
        List<ImageLinkResult> imageLinks = imageLinker.link(input.getImageObservations(),
                context.stream().map(RankedCandidate::getCandidate).collect(Collectors.toList()));

        String recommendationId = UUID.randomUUID().toString();
        auditService.record(RetrievalAuditRecord.builder()
                .inputId(request.getInputId())
                .recommendationId(recommendationId)
                .query(expansion.getExpandedQuery())
                .queryTerms(expansion.getTerms())
                .candidates(context)
                .citedChunkIds(citedChunkIds)
                .imageLinks(imageLinks)
                .build());

        String modelUsed = outcome.isOk() ? outcome.getModel() : HEURISTIC_MODEL;
        DiagnosisPayload payload = DiagnosisPayload.builder()
                .diagnosis(normalized.getDiagnosis())
                .recommendations(normalized.getRecommendations())
                .products(normalized.getProducts())
                .confidence(normalized.getConfidence())
                .generatedAt(clock.instant().toString())
                .inputId(request.getInputId())
                .userId(request.getUserId())
                .jobId(request.getJobId())
                .retrievalQuery(expansion.getExpandedQuery())
                .imageLinks(imageLinks)
                .build();

        log.info("✅ Recommendation {} assembled by {} in {}ms ({} sources, confidence {})",
                recommendationId, modelUsed, System.currentTimeMillis() - start,
                sources.size(), String.format("%.2f", normalized.getConfidence()));

        return RecommendationResult.builder()
                .recommendationId(recommendationId)
                .confidence(normalized.getConfidence())
                .diagnosis(payload)
                .sources(sources)
                .modelUsed(modelUsed)
                .build();
    }

    /**
     * "crop X location Y season Z description {labJson}", skipping absent parts.
     */
    String buildRetrievalQuery(InputSnapshot input) {
        List<String> parts = new ArrayList<>();
        TextNormalizer.nonBlank(input.getCrop()).ifPresent(crop -> parts.add("crop " + crop));
        TextNormalizer.nonBlank(input.getLocation()).ifPresent(location -> parts.add("location " + location));
        TextNormalizer.nonBlank(input.getSeason()).ifPresent(season -> parts.add("season " + season));
        TextNormalizer.nonBlank(input.getDescription()).ifPresent(parts::add);
        if (input.getLabData() != null) {
            parts.add(labDataJson(input.getLabData()));
        }
        return parts.isEmpty() ? QueryExpander.DEFAULT_TERM : String.join(" ", parts);
    }

    private List<RankedCandidate> selectContext(List<RankedCandidate> ranked) {
        RetrievalProperties retrieval = props.getRetrieval();
        int topK = retrieval.getContextCandidates();
        if (retrieval.isMmrEnabled()) {
            return diversifier.diversify(ranked, topK, retrieval.getMmrLambda());
        }
        return ranked.stream().limit(topK).collect(Collectors.toList());
    }

    /**
     * Citations in recommendation order, deduplicated and capped; the top
     * candidate stands in when nothing was cited.
     */
    static List<String> collectCitations(List<RecommendationItem> recommendations, List<RankedCandidate> context) {
        Set<String> cited = new LinkedHashSet<>();
        for (RecommendationItem item : recommendations) {
            cited.addAll(item.getCitations());
        }
        if (cited.isEmpty() && !context.isEmpty()) {
            cited.add(context.get(0).getChunkId());
        }
        return cited.stream().limit(MAX_CITED_SOURCES).collect(Collectors.toList());
    }

    static List<SourceReference> buildSources(List<String> chunkIds, List<RankedCandidate> context) {
        Map<String, RankedCandidate> byId = context.stream()
                .collect(Collectors.toMap(RankedCandidate::getChunkId, Function.identity(), (a, b) -> a));
        return chunkIds.stream()
                .map(byId::get)
                .filter(Objects::nonNull)
                .map(candidate -> SourceReference.builder()
                        .chunkId(candidate.getChunkId())
                        .relevance(TextNormalizer.clamp(candidate.getRankScore(), 0.0, 1.0))
                        .excerpt(excerpt(candidate.getContent()))
                        .build())
                .collect(Collectors.toList());
    }

    private static String excerpt(String content) {
        if (content == null) {
            return "";
        }
        return content.length() <= EXCERPT_LENGTH ? content : content.substring(0, EXCERPT_LENGTH);
    }

    private String labDataJson(Map<String, Double> labData) {
        try {
            return objectMapper.writeValueAsString(labData);
        } catch (JsonProcessingException e) {
            log.warn("⚠️  Could not serialize lab data for retrieval query: {}", e.getOriginalMessage());
            return labData.toString();
        }
    }
}
