package com.cropcopilot.advisor.service.synthesis;

import com.cropcopilot.advisor.model.recommendation.ConditionType;
import com.cropcopilot.advisor.model.recommendation.Diagnosis;
import com.cropcopilot.advisor.model.recommendation.GenerationOutcome;
import com.cropcopilot.advisor.model.recommendation.ModelOutput;
import com.cropcopilot.advisor.model.recommendation.Priority;
import com.cropcopilot.advisor.model.recommendation.ProductSuggestion;
import com.cropcopilot.advisor.model.recommendation.RecommendationItem;
import com.cropcopilot.advisor.model.recommendation.SynthesizedOutput;
import com.cropcopilot.advisor.model.retrieval.RankedCandidate;
import com.cropcopilot.advisor.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Merges model output with the heuristic baseline, field by field, and
 * enforces the output invariants: confidence in [0.5, 0.95], at most three
 * recommendations and four products, citations restricted to the assembled
 * candidates, and at least one citation per recommendation whenever there
 * is a candidate to cite.
 */
@Component
@RequiredArgsConstructor
public class OutputNormalizer {

    public static final double MIN_CONFIDENCE = 0.5;
    public static final double MAX_CONFIDENCE = 0.95;
    static final int MAX_RECOMMENDATIONS = 3;
    static final int MAX_CITATIONS = 3;
    static final int MAX_PRODUCTS = 4;
    static final int MAX_ALTERNATIVES = 4;

    static final String DEFAULT_ACTION = "Validate field symptoms before acting.";
    static final String DEFAULT_DETAILS = "Use representative scouting observations and supporting evidence.";
    static final String DEFAULT_REASONING = "No model output available.";

    private final ConditionClassifier classifier;

    public SynthesizedOutput normalize(GenerationOutcome outcome,
                                       SynthesizedOutput heuristic,
                                       List<RankedCandidate> candidates) {
        ModelOutput model = outcome.isOk() ? outcome.getOutput() : null;
        ModelOutput.RawDiagnosis rawDiagnosis = model == null ? null : model.getDiagnosis();
        Diagnosis fallback = heuristic.getDiagnosis();

        String fallbackCondition = TextNormalizer.nonBlank(fallback.getCondition()).orElse("unknown");
        ConditionType fallbackType = fallback.getConditionType() == null
                ? ConditionType.UNKNOWN
                : fallback.getConditionType();
        double fallbackConfidence = TextNormalizer.clamp(fallback.getConfidence(), MIN_CONFIDENCE, MAX_CONFIDENCE);
        String fallbackReasoning = TextNormalizer.nonBlank(fallback.getReasoning()).orElse(DEFAULT_REASONING);

        double confidence = TextNormalizer.clamp(
                Stream.of(rawDiagnosis == null ? null : rawDiagnosis.getConfidence(),
                                model == null ? null : model.getConfidence())
                        .filter(Objects::nonNull)
                        .filter(Double::isFinite)
                        .findFirst()
                        .orElse(fallbackConfidence),
                MIN_CONFIDENCE, MAX_CONFIDENCE);

        String condition = TextNormalizer.nonBlank(rawDiagnosis == null ? null : rawDiagnosis.getCondition())
                .orElse(fallbackCondition);
        ConditionType conditionType = resolveConditionType(
                rawDiagnosis == null ? null : rawDiagnosis.getConditionType(), condition, fallbackType);
        String reasoning = TextNormalizer.nonBlank(rawDiagnosis == null ? null : rawDiagnosis.getReasoning())
                .orElse(fallbackReasoning);

        List<String> orderedIds = candidates.stream()
                .map(RankedCandidate::getChunkId)
                .collect(Collectors.toList());

        List<RecommendationItem> recommendations = model != null
                && model.getRecommendations() != null
                && !model.getRecommendations().isEmpty()
                ? model.getRecommendations().stream()
                        .limit(MAX_RECOMMENDATIONS)
                        .map(raw -> fromRaw(raw, orderedIds))
                        .collect(Collectors.toList())
                : heuristic.getRecommendations().stream()
                        .limit(MAX_RECOMMENDATIONS)
                        .map(item -> revalidate(item, orderedIds))
                        .collect(Collectors.toList());

        List<ProductSuggestion> products = model == null || model.getProducts() == null
                ? List.of()
                : model.getProducts().stream()
                        .map(OutputNormalizer::toProduct)
                        .filter(Objects::nonNull)
                        .limit(MAX_PRODUCTS)
                        .collect(Collectors.toList());

        return SynthesizedOutput.builder()
                .diagnosis(Diagnosis.builder()
                        .condition(condition)
                        .conditionType(conditionType)
                        .confidence(confidence)
                        .reasoning(reasoning)
                        .build())
                .recommendations(recommendations)
                .products(products)
                .confidence(confidence)
                .build();
    }

    /**
     * A valid model value wins; otherwise the condition text is classified,
     * and only an unclassifiable condition takes the heuristic type.
     */
    ConditionType resolveConditionType(String raw, String condition, ConditionType fallbackType) {
        return ConditionType.parse(raw).orElseGet(() -> {
            ConditionType inferred = classifier.classify(condition).getConditionType();
            return inferred != ConditionType.UNKNOWN ? inferred : fallbackType;
        });
    }

    /**
     * Keep cited ids that exist among the candidates, in order and without
     * duplicates; inject the top candidate when none survive.
     */
    static List<String> normalizeCitations(List<String> raw, List<String> orderedCandidateIds) {
        Set<String> known = new LinkedHashSet<>(orderedCandidateIds);
        Set<String> kept = new LinkedHashSet<>();
        if (raw != null) {
            for (String citation : raw) {
                TextNormalizer.nonBlank(citation)
                        .filter(known::contains)
                        .ifPresent(kept::add);
            }
        }
        if (kept.isEmpty() && !orderedCandidateIds.isEmpty()) {
            kept.add(orderedCandidateIds.get(0));
        }
        return kept.stream().limit(MAX_CITATIONS).collect(Collectors.toList());
    }

    private static RecommendationItem fromRaw(ModelOutput.RawRecommendation raw, List<String> orderedIds) {
        return RecommendationItem.builder()
                .action(TextNormalizer.nonBlank(raw.getAction()).orElse(DEFAULT_ACTION))
                .priority(Priority.parse(raw.getPriority()).orElse(Priority.SOON))
                .timing(TextNormalizer.nonBlank(raw.getTiming()).orElse(null))
                .details(TextNormalizer.nonBlank(raw.getDetails()).orElse(DEFAULT_DETAILS))
                .citations(normalizeCitations(raw.getCitations(), orderedIds))
                .build();
    }

    private static RecommendationItem revalidate(RecommendationItem item, List<String> orderedIds) {
        return RecommendationItem.builder()
                .action(TextNormalizer.nonBlank(item.getAction()).orElse(DEFAULT_ACTION))
                .priority(item.getPriority() == null ? Priority.SOON : item.getPriority())
                .timing(TextNormalizer.nonBlank(item.getTiming()).orElse(null))
                .details(TextNormalizer.nonBlank(item.getDetails()).orElse(DEFAULT_DETAILS))
                .citations(normalizeCitations(item.getCitations(), orderedIds))
                .build();
    }

    /**
     * Null when the product lacks an id or a reason.
     */
    private static ProductSuggestion toProduct(ModelOutput.RawProduct raw) {
        String productId = TextNormalizer.nonBlank(raw.getProductId()).orElse(null);
        String reason = TextNormalizer.nonBlank(raw.getReason()).orElse(null);
        if (productId == null || reason == null) {
            return null;
        }
        List<String> alternatives = new ArrayList<>();
        if (raw.getAlternatives() != null) {
            raw.getAlternatives().stream()
                    .map(TextNormalizer::nonBlank)
                    .flatMap(Optional::stream)
                    .limit(MAX_ALTERNATIVES)
                    .forEach(alternatives::add);
        }
        return ProductSuggestion.builder()
                .productId(productId)
                .productName(TextNormalizer.nonBlank(raw.getProductName()).orElse(null))
                .reason(reason)
                .applicationRate(TextNormalizer.nonBlank(raw.getApplicationRate()).orElse(null))
                .alternatives(alternatives)
                .build();
    }
}
