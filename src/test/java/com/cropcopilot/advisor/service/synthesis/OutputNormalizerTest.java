package com.cropcopilot.advisor.service.synthesis;

import com.cropcopilot.advisor.model.recommendation.ConditionType;
import com.cropcopilot.advisor.model.recommendation.GenerationOutcome;
import com.cropcopilot.advisor.model.recommendation.InputSnapshot;
import com.cropcopilot.advisor.model.recommendation.InputType;
import com.cropcopilot.advisor.model.recommendation.ModelOutput;
import com.cropcopilot.advisor.model.recommendation.Priority;
import com.cropcopilot.advisor.model.recommendation.RecommendationItem;
import com.cropcopilot.advisor.model.recommendation.SynthesizedOutput;
import com.cropcopilot.advisor.model.retrieval.RankedCandidate;
import com.cropcopilot.advisor.model.retrieval.SourceType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.cropcopilot.advisor.service.synthesis.HeuristicOutputBuilderTest.ranked;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Output Normalizer Tests")
class OutputNormalizerTest {

    private final ConditionClassifier classifier = new ConditionClassifier();
    private final HeuristicOutputBuilder heuristicBuilder = new HeuristicOutputBuilder(classifier, new ObjectMapper());
    private final OutputNormalizer normalizer = new OutputNormalizer(classifier);

    private final List<RankedCandidate> candidates = List.of(
            ranked("c-1", "Extension bulletin", SourceType.UNIVERSITY_EXTENSION, 0.9),
            ranked("c-2", "State guide", SourceType.GOVERNMENT, 0.7));

    private final InputSnapshot input = InputSnapshot.builder()
            .type(InputType.PHOTO)
            .description("Interveinal chlorosis on soybean trifoliates")
            .build();

    @Test
    @DisplayName("Failed model call should yield the heuristic deficiency diagnosis")
    void testNormalize_UnavailableModelShouldUseHeuristic() {
        // Given
        SynthesizedOutput heuristic = heuristicBuilder.build(input, candidates);

        // When
        SynthesizedOutput output = normalizer.normalize(
                GenerationOutcome.unavailable("connection refused"), heuristic, candidates);

        // Then
        assertEquals(ConditionType.DEFICIENCY, output.getDiagnosis().getConditionType());
        assertEquals("probable_nutrient_deficiency_or_root_stress", output.getDiagnosis().getCondition());
        assertEquals(heuristic.getConfidence(), output.getConfidence(), 1e-9);
        assertEquals(2, output.getRecommendations().size());
        output.getRecommendations().forEach(item -> assertFalse(item.getCitations().isEmpty()));
    }

    @Test
    @DisplayName("Model fields should win and fall back one by one")
    void testNormalize_ShouldMergeFieldByField() {
        // Given
        ModelOutput model = new ModelOutput();
        ModelOutput.RawDiagnosis diagnosis = new ModelOutput.RawDiagnosis();
        diagnosis.setCondition("Iron deficiency chlorosis");
        diagnosis.setConditionType("not-a-type");
        diagnosis.setConfidence(1.4);
        model.setDiagnosis(diagnosis);

        // When
        SynthesizedOutput output = normalizer.normalize(
                GenerationOutcome.ok("gemini-1.5-flash", model), heuristicBuilder.build(input, candidates), candidates);

        // Then
        assertEquals("Iron deficiency chlorosis", output.getDiagnosis().getCondition());
        assertEquals(ConditionType.DEFICIENCY, output.getDiagnosis().getConditionType());
        assertEquals(OutputNormalizer.MAX_CONFIDENCE, output.getConfidence());
        assertEquals(OutputNormalizer.MAX_CONFIDENCE, output.getDiagnosis().getConfidence());
        assertTrue(output.getDiagnosis().getReasoning().startsWith("Heuristic diagnosis"));
    }

    @Test
    @DisplayName("Should drop unknown citations and inject the top candidate when none remain")
    void testNormalize_ShouldValidateCitations() {
        // Given
        ModelOutput model = new ModelOutput();
        List<ModelOutput.RawRecommendation> raw = new ArrayList<>();
        raw.add(recommendation("Apply foliar iron", "urgent", List.of("c-9", "c-2", "c-2")));
        raw.add(recommendation(" ", "immediate", List.of("hallucinated")));
        raw.add(recommendation("Retest pH", "when_convenient", null));
        raw.add(recommendation("Fourth one", "soon", List.of("c-1")));
        model.setRecommendations(raw);

        // When
        SynthesizedOutput output = normalizer.normalize(
                GenerationOutcome.ok("gemini-1.5-flash", model), heuristicBuilder.build(input, candidates), candidates);

        // Then
        List<RecommendationItem> items = output.getRecommendations();
        assertEquals(3, items.size());
        assertEquals(List.of("c-2"), items.get(0).getCitations());
        assertEquals(Priority.SOON, items.get(0).getPriority());
        assertEquals(List.of("c-1"), items.get(1).getCitations());
        assertEquals("Validate field symptoms before acting.", items.get(1).getAction());
        assertEquals(Priority.WHEN_CONVENIENT, items.get(2).getPriority());
        assertEquals(List.of("c-1"), items.get(2).getCitations());
    }

    @Test
    @DisplayName("Should keep at most four valid products")
    void testNormalize_ShouldCapProducts() {
        // Given
        ModelOutput model = new ModelOutput();
        List<ModelOutput.RawProduct> products = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            ModelOutput.RawProduct product = new ModelOutput.RawProduct();
            product.setProductId("p-" + i);
            product.setReason(i == 1 ? null : "Corrects deficiency");
            product.setApplicationRate("2 lb/acre");
            products.add(product);
        }
        model.setProducts(products);

        // When
        SynthesizedOutput output = normalizer.normalize(
                GenerationOutcome.ok("gemini-1.5-flash", model), heuristicBuilder.build(input, candidates), candidates);

        // Then
        assertEquals(4, output.getProducts().size());
        assertEquals("p-0", output.getProducts().get(0).getProductId());
        assertEquals("p-2", output.getProducts().get(1).getProductId());
    }

    @Test
    @DisplayName("Citation normalization should return nothing only without candidates")
    void testNormalizeCitations_WithoutCandidates() {
        assertTrue(OutputNormalizer.normalizeCitations(List.of("c-1"), List.of()).isEmpty());
        assertEquals(List.of("c-1"), OutputNormalizer.normalizeCitations(null, List.of("c-1", "c-2")));
    }

    private static ModelOutput.RawRecommendation recommendation(String action, String priority, List<String> citations) {
        ModelOutput.RawRecommendation recommendation = new ModelOutput.RawRecommendation();
        recommendation.setAction(action);
        recommendation.setPriority(priority);
        recommendation.setCitations(citations);
        return recommendation;
    }
}
