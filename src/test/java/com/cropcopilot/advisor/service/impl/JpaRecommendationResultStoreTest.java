package com.cropcopilot.advisor.service.impl;

import com.cropcopilot.advisor.model.corpus.ProductEntity;
import com.cropcopilot.advisor.model.corpus.ProductRecommendationEntity;
import com.cropcopilot.advisor.model.intake.FieldInputEntity;
import com.cropcopilot.advisor.model.job.RecommendationEntity;
import com.cropcopilot.advisor.model.recommendation.ConditionType;
import com.cropcopilot.advisor.model.recommendation.Diagnosis;
import com.cropcopilot.advisor.model.recommendation.DiagnosisPayload;
import com.cropcopilot.advisor.model.recommendation.ProductSuggestion;
import com.cropcopilot.advisor.model.recommendation.RecommendationItem;
import com.cropcopilot.advisor.model.recommendation.RecommendationResult;
import com.cropcopilot.advisor.repository.FieldInputRepository;
import com.cropcopilot.advisor.repository.ProductRecommendationRepository;
import com.cropcopilot.advisor.repository.ProductRepository;
import com.cropcopilot.advisor.repository.RecommendationRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Recommendation Result Store Tests")
class JpaRecommendationResultStoreTest {

    @Mock
    private RecommendationRepository recommendationRepository;

    @Mock
    private ProductRecommendationRepository productRecommendationRepository;

    @Mock
    private ProductRepository productRepository;

    @Mock
    private FieldInputRepository fieldInputRepository;

    @Captor
    private ArgumentCaptor<List<ProductRecommendationEntity>> planCaptor;

    private JpaRecommendationResultStore store;

    @BeforeEach
    void setUp() {
        store = new JpaRecommendationResultStore(recommendationRepository, productRecommendationRepository,
                productRepository, fieldInputRepository, new ObjectMapper());
    }

    @Test
    @DisplayName("Unknown product id should resolve through its catalog alternative")
    void testSave_ShouldResolveProductThroughAlternative() {
        // Given
        ProductSuggestion suggestion = ProductSuggestion.builder()
                .productId("unknown-sku")
                .reason("Restores nitrogen supply")
                .applicationRate("40 lb/acre")
                .alternatives(List.of("prod-42"))
                .build();
        when(productRepository.findAllById(Set.of("unknown-sku", "prod-42")))
                .thenReturn(List.of(product("prod-42", "UAN 28", "FERTILIZER", "32 lb/acre", "")));
        givenFirstResultForJob();

        // When
        store.save("job-1", "user-1", result(ConditionType.DEFICIENCY, List.of(suggestion)));

        // Then
        verify(productRecommendationRepository).saveAll(planCaptor.capture());
        List<ProductRecommendationEntity> plan = planCaptor.getValue();
        assertEquals(1, plan.size());
        assertEquals("prod-42", plan.get(0).getProductId());
        assertEquals("40 lb/acre", plan.get(0).getApplicationRate());
        assertEquals("Restores nitrogen supply", plan.get(0).getReason());
        assertEquals(1, plan.get(0).getPriority());
    }

    @Test
    @DisplayName("Product name should match the catalog case-insensitively and take the label rate")
    void testSave_ShouldResolveProductByNameWithCatalogRate() {
        // Given
        ProductSuggestion suggestion = ProductSuggestion.builder()
                .productId("made-up")
                .productName("  Headline AMP ")
                .reason("Protects leaves from gray leaf spot")
                .build();
        when(productRepository.findAllById(Set.of("made-up"))).thenReturn(List.of());
        when(productRepository.findByLowerNameIn(Set.of("headline amp")))
                .thenReturn(List.of(product("prod-7", "Headline AMP", "FUNGICIDE", "10 fl oz/acre", "corn")));
        givenFirstResultForJob();

        // When
        store.save("job-1", "user-1", result(ConditionType.DISEASE, List.of(suggestion)));

        // Then
        verify(productRecommendationRepository).saveAll(planCaptor.capture());
        List<ProductRecommendationEntity> plan = planCaptor.getValue();
        assertEquals(1, plan.size());
        assertEquals("prod-7", plan.get(0).getProductId());
        assertEquals("10 fl oz/acre", plan.get(0).getApplicationRate());
    }

    @Test
    @DisplayName("Two suggestions naming the same product should not list it twice")
    void testSave_ShouldNotRepeatCatalogProduct() {
        // Given
        ProductEntity urea = product("prod-1", "Urea 46", "FERTILIZER", "100 lb/acre", "");
        List<ProductSuggestion> suggestions = List.of(
                ProductSuggestion.builder().productId("prod-1").reason("First").build(),
                ProductSuggestion.builder().productId("prod-1").reason("Again").build());
        when(productRepository.findAllById(Set.of("prod-1"))).thenReturn(List.of(urea));
        givenFirstResultForJob();

        // When
        store.save("job-1", "user-1", result(ConditionType.DEFICIENCY, suggestions));

        // Then
        verify(productRecommendationRepository).saveAll(planCaptor.capture());
        assertEquals(1, planCaptor.getValue().size());
        assertEquals("First", planCaptor.getValue().get(0).getReason());
    }

    @Test
    @DisplayName("Without suggested products the plan should come from catalog products for the condition and crop")
    void testSave_ShouldFallBackToCatalogByConditionAndCrop() {
        // Given
        FieldInputEntity input = new FieldInputEntity();
        input.setId("input-1");
        input.setCrop("Corn");
        when(fieldInputRepository.findById("input-1")).thenReturn(Optional.of(input));
        when(productRepository.findByProductTypes(anyCollection())).thenReturn(List.of(
                product("p-soy", "Soy Only", "FERTILIZER", "5 gal/acre", "soybeans"),
                product("p-any", "Generic Lime", "AMENDMENT", "1 ton/acre", null),
                product("p-corn", "Corn Starter", "FERTILIZER", "3 gal/acre", "corn, sorghum")));
        givenFirstResultForJob();

        // When
        store.save("job-1", "user-1", result(ConditionType.DEFICIENCY, List.of()));

        // Then
        verify(productRepository).findByProductTypes(Set.of("FERTILIZER", "AMENDMENT"));
        verify(productRecommendationRepository).saveAll(planCaptor.capture());
        List<ProductRecommendationEntity> plan = planCaptor.getValue();
        assertEquals(2, plan.size());
        assertEquals("p-corn", plan.get(0).getProductId());
        assertEquals("3 gal/acre", plan.get(0).getApplicationRate());
        assertEquals("p-any", plan.get(1).getProductId());
        assertEquals(2, plan.get(1).getPriority());
        assertTrue(plan.get(0).getReason().contains("Corn"));
    }

    @Test
    @DisplayName("Catalog fallback should stop at four products")
    void testSave_ShouldCapCatalogFallback() {
        // Given
        when(productRepository.findByProductTypes(anyCollection())).thenReturn(List.of(
                product("a", "A", "FUNGICIDE", "1 pt/acre", null),
                product("b", "B", "FUNGICIDE", "1 pt/acre", null),
                product("c", "C", "BIOLOGICAL", "1 pt/acre", null),
                product("d", "D", "BIOLOGICAL", "1 pt/acre", null),
                product("e", "E", "FUNGICIDE", "1 pt/acre", null)));
        givenFirstResultForJob();

        // When
        store.save("job-1", "user-1", resultWithoutInput(ConditionType.DISEASE));

        // Then
        verify(productRecommendationRepository).saveAll(planCaptor.capture());
        assertEquals(JpaRecommendationResultStore.MAX_PLAN_PRODUCTS, planCaptor.getValue().size());
        verifyNoInteractions(fieldInputRepository);
    }

    @Test
    @DisplayName("Unknown condition with nothing typed in the catalog should use any catalog product")
    void testSave_ShouldUseAnyCatalogProductWhenNoTypeMatches() {
        // Given
        when(productRepository.findByProductTypes(anyCollection())).thenReturn(List.of());
        when(productRepository.findTop4ByOrderByNameAsc())
                .thenReturn(List.of(product("x", "Xtra", null, null, null)));
        givenFirstResultForJob();

        // When
        store.save("job-1", "user-1", resultWithoutInput(ConditionType.UNKNOWN));

        // Then
        verify(productRepository).findByProductTypes(Set.of("BIOLOGICAL", "AMENDMENT", "FERTILIZER"));
        verify(productRecommendationRepository).saveAll(planCaptor.capture());
        assertEquals(1, planCaptor.getValue().size());
        assertNull(planCaptor.getValue().get(0).getApplicationRate());
    }

    @Test
    @DisplayName("Pest wording in the recommended actions should add insecticides to the hints")
    void testProductTypeHints_ShouldReadRecommendedActions() {
        // Given
        DiagnosisPayload payload = DiagnosisPayload.builder()
                .diagnosis(Diagnosis.builder().condition("Leaf damage").conditionType(ConditionType.UNKNOWN).build())
                .recommendations(List.of(RecommendationItem.builder()
                        .action("Scout for corn borer larvae")
                        .build()))
                .build();

        // When
        Set<String> hints = JpaRecommendationResultStore.productTypeHints(payload);

        // Then
        assertEquals(Set.of("INSECTICIDE", "BIOLOGICAL"), hints);
    }

    private void givenFirstResultForJob() {
        when(recommendationRepository.findByJobId("job-1")).thenReturn(Optional.empty());
        when(recommendationRepository.save(any(RecommendationEntity.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private static RecommendationResult result(ConditionType type, List<ProductSuggestion> products) {
        return RecommendationResult.builder()
                .recommendationId("rec-1")
                .confidence(0.7)
                .modelUsed("rag-v2")
                .diagnosis(DiagnosisPayload.builder()
                        .diagnosis(Diagnosis.builder()
                                .condition("Nitrogen deficiency")
                                .conditionType(type)
                                .confidence(0.7)
                                .build())
                        .products(products)
                        .inputId("input-1")
                        .build())
                .build();
    }

    private static RecommendationResult resultWithoutInput(ConditionType type) {
        return RecommendationResult.builder()
                .recommendationId("rec-2")
                .confidence(0.6)
                .modelUsed("rag-v2")
                .diagnosis(DiagnosisPayload.builder()
                        .diagnosis(Diagnosis.builder().conditionType(type).confidence(0.6).build())
                        .build())
                .build();
    }

    private static ProductEntity product(String id, String name, String type, String rate, String crops) {
        return ProductEntity.builder()
                .id(id)
                .name(name)
                .productType(type)
                .applicationRate(rate)
                .crops(crops)
                .build();
    }
}
