package com.cropcopilot.advisor.service.synthesis;

import com.cropcopilot.advisor.model.recommendation.ConditionType;
import com.cropcopilot.advisor.model.recommendation.Diagnosis;
import com.cropcopilot.advisor.model.recommendation.InputSnapshot;
import com.cropcopilot.advisor.model.recommendation.Priority;
import com.cropcopilot.advisor.model.recommendation.RecommendationItem;
import com.cropcopilot.advisor.model.recommendation.SynthesizedOutput;
import com.cropcopilot.advisor.model.retrieval.RankedCandidate;
import com.cropcopilot.advisor.util.TextNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Deterministic diagnosis built from the submitted symptoms and the top
 * ranked passages. Always available; it is the baseline every model answer
 * is normalized against.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HeuristicOutputBuilder {

    static final double BASE_CONFIDENCE = 0.62;
    static final double NO_CONTEXT_CONFIDENCE = 0.58;

    private final ConditionClassifier classifier;
    private final ObjectMapper objectMapper;

    public SynthesizedOutput build(InputSnapshot input, List<RankedCandidate> candidates) {
        ConditionClassifier.Classification classification = classifier.classify(summaryText(input));

        double confidence = TextNormalizer.clamp(
                candidates.isEmpty()
                        ? NO_CONTEXT_CONFIDENCE
                        : BASE_CONFIDENCE + Math.min(0.25, candidates.get(0).getRankScore() * 0.2),
                0.5, 0.9);

        List<String> citationIds = candidates.stream()
                .limit(2)
                .map(RankedCandidate::getChunkId)
                .collect(Collectors.toList());
        String evidenceSummary = candidates.isEmpty()
                ? "limited retrieved context"
                : candidates.stream()
                        .limit(2)
                        .map(c -> c.getSourceTitle() + " (" + c.getSourceType().getValue() + ")")
                        .collect(Collectors.joining("; "));

        Diagnosis diagnosis = Diagnosis.builder()
                .condition(classification.getCondition())
                .conditionType(classification.getConditionType())
                .confidence(confidence)
                .reasoning("Heuristic diagnosis from submitted symptoms with supporting context from "
                        + evidenceSummary + ".")
                .build();

        RecommendationItem confirm = RecommendationItem.builder()
                .action(classification.getConditionType() == ConditionType.DEFICIENCY
                        ? "Collect tissue and soil samples before corrective application."
                        : "Scout additional zones and confirm spread pattern before treatment.")
                .priority(Priority.IMMEDIATE)
                .timing("Within 24-48 hours")
                .details("Validate field variability and confirm diagnosis using representative samples "
                        + "from affected and healthy areas.")
                .citations(citationIds)
                .build();

        RecommendationItem monitor = RecommendationItem.builder()
                .action("Track progression and weather-driven risk over the next few days.")
                .priority(Priority.SOON)
                .timing("Next 3-5 days")
                .details("Monitor severity changes to determine whether intervention thresholds are reached.")
                .citations(citationIds.stream().limit(1).collect(Collectors.toList()))
                .build();

        return SynthesizedOutput.builder()
                .diagnosis(diagnosis)
                .recommendations(List.of(confirm, monitor))
                .products(List.of())
                .confidence(confidence)
                .build();
    }

    /**
     * Description and lab values, lowercased, as one string for the classifier.
     */
    String summaryText(InputSnapshot input) {
        String description = input.getDescription() == null ? "" : input.getDescription();
        return (description + " " + labDataJson(input.getLabData())).toLowerCase(Locale.ROOT);
    }

    private String labDataJson(Map<String, Double> labData) {
        if (labData == null || labData.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(labData);
        } catch (JsonProcessingException e) {
            log.warn("⚠️  Could not serialize lab data: {}", e.getOriginalMessage());
            return labData.toString();
        }
    }
}
