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
import com.cropcopilot.advisor.service.RecommendationResultStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaRecommendationResultStore implements RecommendationResultStore {

    static final int MAX_PLAN_PRODUCTS = 4;

    private static final int MAX_HINT_ACTIONS = 6;

    private static final Pattern DEFICIENCY_HINT = Pattern.compile("deficien|chlorosis|nutrient|npk|nitrogen");
    private static final Pattern DISEASE_HINT = Pattern.compile("fung|mildew|blight|rot|rust|spot|pathogen");
    private static final Pattern PEST_HINT = Pattern.compile("insect|aphid|worm|beetle|mite|borer|pest");
    private static final Pattern ENVIRONMENTAL_HINT = Pattern.compile("stress|drought|water|heat|soil structure");

    private final RecommendationRepository recommendationRepository;
    private final ProductRecommendationRepository productRecommendationRepository;
    private final ProductRepository productRepository;
    private final FieldInputRepository fieldInputRepository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional
    public RecommendationEntity save(String jobId, String userId, RecommendationResult result) {
        recommendationRepository.findByJobId(jobId).ifPresent(previous -> {
            log.info("♻️  Replacing recommendation {} previously stored for job {}", previous.getId(), jobId);
            productRecommendationRepository.deleteByRecommendationId(previous.getId());
            recommendationRepository.delete(previous);
            recommendationRepository.flush();
        });

        Diagnosis diagnosis = result.getDiagnosis().getDiagnosis();
        RecommendationEntity entity = recommendationRepository.save(RecommendationEntity.builder()
                .id(result.getRecommendationId())
                .jobId(jobId)
                .inputId(result.getDiagnosis().getInputId())
                .userId(userId)
                .confidence(result.getConfidence())
                .modelUsed(result.getModelUsed())
                .conditionType(diagnosis == null || diagnosis.getConditionType() == null
                        ? null
                        : diagnosis.getConditionType().getValue())
                .payload(toJson(result))
                .build());

        List<ProductRecommendationEntity> plan = productPlan(result);
        productRecommendationRepository.saveAll(plan);

        log.info("💾 Stored recommendation {} for job {} ({} catalog products)", entity.getId(), jobId, plan.size());
        return entity;
    }

    /**
     * Catalog products for the recommendation, in priority order. Suggestions
     * are resolved first; when none names a catalog product the plan is filled
     * from the catalog by condition and crop.
     */
    private List<ProductRecommendationEntity> productPlan(RecommendationResult result) {
        DiagnosisPayload payload = result.getDiagnosis();
        List<ProductRecommendationEntity> rows = resolveSuggested(result.getRecommendationId(), payload);
        if (rows.isEmpty()) {
            rows = catalogFallback(result.getRecommendationId(), payload);
        }
        for (int i = 0; i < rows.size(); i++) {
            rows.get(i).setPriority(i + 1);
        }
        return rows;
    }

    private List<ProductRecommendationEntity> resolveSuggested(String recommendationId, DiagnosisPayload payload) {
        List<ProductSuggestion> suggestions = payload.getProducts();
        if (suggestions.isEmpty()) {
            return new ArrayList<>();
        }

        Set<String> ids = new LinkedHashSet<>();
        Set<String> names = new LinkedHashSet<>();
        for (ProductSuggestion suggestion : suggestions) {
            ids.addAll(candidateIds(suggestion));
            if (suggestion.getProductName() != null && !suggestion.getProductName().isBlank()) {
                names.add(normalizeName(suggestion.getProductName()));
            }
        }

        Map<String, ProductEntity> catalog = new LinkedHashMap<>();
        if (!ids.isEmpty()) {
            productRepository.findAllById(ids).forEach(product -> catalog.putIfAbsent(product.getId(), product));
        }
        if (!names.isEmpty()) {
            productRepository.findByLowerNameIn(names).forEach(product -> catalog.putIfAbsent(product.getId(), product));
        }
        if (catalog.isEmpty()) {
            for (String name : names) {
                productRepository.findTop20ByNameContainingIgnoreCaseOrderByNameAsc(name)
                        .forEach(product -> catalog.putIfAbsent(product.getId(), product));
            }
        }
        if (catalog.isEmpty()) {
            log.debug("No product suggestion for recommendation {} matched the catalog", recommendationId);
            return new ArrayList<>();
        }

        List<ProductRecommendationEntity> rows = new ArrayList<>();
        Set<String> used = new HashSet<>();
        for (ProductSuggestion suggestion : suggestions) {
            ProductEntity match = candidateIds(suggestion).stream()
                    .map(catalog::get)
                    .filter(product -> product != null && !used.contains(product.getId()))
                    .findFirst()
                    .orElseGet(() -> matchByName(catalog.values(), suggestion.getProductName(), used));
            if (match == null) {
                log.debug("Skipping product suggestion {} not present in the catalog", suggestion.getProductId());
                continue;
            }
            used.add(match.getId());
            rows.add(ProductRecommendationEntity.builder()
                    .recommendationId(recommendationId)
                    .productId(match.getId())
                    .applicationRate(suggestion.getApplicationRate() != null
                            ? suggestion.getApplicationRate()
                            : match.getApplicationRate())
                    .reason(suggestion.getReason() != null
                            ? suggestion.getReason()
                            : fallbackReason(match, payload.getDiagnosis(), null))
                    .build());
            if (rows.size() >= MAX_PLAN_PRODUCTS) {
                break;
            }
        }
        return rows;
    }

    private List<ProductRecommendationEntity> catalogFallback(String recommendationId, DiagnosisPayload payload) {
        Set<String> types = productTypeHints(payload);
        String crop = cropOf(payload);

        List<ProductEntity> selected = productRepository.findByProductTypes(types).stream()
                .filter(product -> cropRank(product, crop) < 2)
                .sorted(Comparator.comparingInt(product -> cropRank(product, crop)))
                .limit(MAX_PLAN_PRODUCTS)
                .collect(Collectors.toList());
        if (selected.isEmpty()) {
            selected = productRepository.findTop4ByOrderByNameAsc();
        }
        if (!selected.isEmpty()) {
            log.info("🧺 No suggested product matched the catalog; using {} catalog products for {} ({})",
                    selected.size(), types, crop == null ? "any crop" : crop);
        }

        List<ProductRecommendationEntity> rows = new ArrayList<>();
        for (ProductEntity product : selected) {
            rows.add(ProductRecommendationEntity.builder()
                    .recommendationId(recommendationId)
                    .productId(product.getId())
                    .applicationRate(product.getApplicationRate())
                    .reason(fallbackReason(product, payload.getDiagnosis(), crop))
                    .build());
        }
        return rows;
    }

    /**
     * Uppercase catalog product types suited to the diagnosed condition.
     */
    static Set<String> productTypeHints(DiagnosisPayload payload) {
        Diagnosis diagnosis = payload.getDiagnosis();
        ConditionType type = diagnosis == null ? null : diagnosis.getConditionType();
        String text = (diagnosis == null || diagnosis.getCondition() == null ? "" : diagnosis.getCondition())
                + " "
                + payload.getRecommendations().stream()
                        .limit(MAX_HINT_ACTIONS)
                        .map(RecommendationItem::getAction)
                        .filter(action -> action != null)
                        .collect(Collectors.joining(" "));
        text = text.toLowerCase(Locale.ROOT);

        Set<String> hints = new LinkedHashSet<>();
        if (type == ConditionType.DEFICIENCY || DEFICIENCY_HINT.matcher(text).find()) {
            hints.add("FERTILIZER");
            hints.add("AMENDMENT");
        }
        if (type == ConditionType.DISEASE || DISEASE_HINT.matcher(text).find()) {
            hints.add("FUNGICIDE");
            hints.add("BIOLOGICAL");
        }
        if (type == ConditionType.PEST || PEST_HINT.matcher(text).find()) {
            hints.add("INSECTICIDE");
            hints.add("BIOLOGICAL");
        }
        if (type == ConditionType.ENVIRONMENTAL || ENVIRONMENTAL_HINT.matcher(text).find()) {
            hints.add("AMENDMENT");
        }
        if (hints.isEmpty()) {
            hints.addAll(List.of("BIOLOGICAL", "AMENDMENT", "FERTILIZER"));
        }
        return hints;
    }

    /**
     * 0 when the label lists the crop, 1 when it lists no crops, 2 otherwise.
     */
    private static int cropRank(ProductEntity product, String crop) {
        if (crop == null) {
            return 0;
        }
        List<String> crops = product.getCrops() == null
                ? List.of()
                : Arrays.stream(product.getCrops().split(","))
                        .map(String::trim)
                        .filter(name -> !name.isEmpty())
                        .collect(Collectors.toList());
        if (crops.isEmpty()) {
            return 1;
        }
        return crops.stream().anyMatch(name -> name.equalsIgnoreCase(crop)) ? 0 : 2;
    }

    private String cropOf(DiagnosisPayload payload) {
        if (payload.getInputId() == null) {
            return null;
        }
        return fieldInputRepository.findById(payload.getInputId())
                .map(FieldInputEntity::getCrop)
                .filter(crop -> !crop.isBlank())
                .orElse(null);
    }

    private static List<String> candidateIds(ProductSuggestion suggestion) {
        List<String> ids = new ArrayList<>();
        if (suggestion.getProductId() != null) {
            ids.add(suggestion.getProductId());
        }
        suggestion.getAlternatives().stream()
                .filter(id -> id != null && !ids.contains(id))
                .forEach(ids::add);
        return ids;
    }

    /**
     * Exact name first, then the first unused product whose name contains it.
     */
    private static ProductEntity matchByName(Collection<ProductEntity> catalog, String name, Set<String> used) {
        if (name == null || name.isBlank()) {
            return null;
        }
        String wanted = normalizeName(name);
        return catalog.stream()
                .filter(product -> !used.contains(product.getId()))
                .filter(product -> normalizeName(product.getName()).equals(wanted))
                .findFirst()
                .orElseGet(() -> catalog.stream()
                        .filter(product -> !used.contains(product.getId()))
                        .filter(product -> normalizeName(product.getName()).contains(wanted))
                        .findFirst()
                        .orElse(null));
    }

    private static String normalizeName(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private static String fallbackReason(ProductEntity product, Diagnosis diagnosis, String crop) {
        String issue = diagnosis == null
                ? ConditionType.UNKNOWN.getValue()
                : diagnosis.getCondition() != null
                        ? diagnosis.getCondition()
                        : diagnosis.getConditionType() == null
                                ? ConditionType.UNKNOWN.getValue()
                                : diagnosis.getConditionType().getValue();
        String registrant = product.getRegistrant() == null ? "" : " by " + product.getRegistrant();
        return product.getName() + registrant + " aligns with " + (crop == null ? "this crop" : crop)
                + " management for " + issue + ".";
    }

    private String toJson(RecommendationResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize recommendation " + result.getRecommendationId(), e);
        }
    }
}
