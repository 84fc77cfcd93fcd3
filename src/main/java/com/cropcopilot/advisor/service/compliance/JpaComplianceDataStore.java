package com.cropcopilot.advisor.service.compliance;

import com.cropcopilot.advisor.model.audit.ComplianceAuditLogEntity;
import com.cropcopilot.advisor.model.audit.PremiumInsightEntity;
import com.cropcopilot.advisor.model.compliance.ComplianceCheckResult;
import com.cropcopilot.advisor.model.compliance.ComplianceEvaluation;
import com.cropcopilot.advisor.model.compliance.ComplianceInput;
import com.cropcopilot.advisor.model.compliance.PlannedProduct;
import com.cropcopilot.advisor.model.compliance.PremiumInsight;
import com.cropcopilot.advisor.model.compliance.RiskReviewDecision;
import com.cropcopilot.advisor.model.corpus.ProductEntity;
import com.cropcopilot.advisor.model.corpus.ProductRecommendationEntity;
import com.cropcopilot.advisor.model.intake.FieldInputEntity;
import com.cropcopilot.advisor.model.job.RecommendationEntity;
import com.cropcopilot.advisor.repository.ComplianceAuditLogRepository;
import com.cropcopilot.advisor.repository.FieldInputRepository;
import com.cropcopilot.advisor.repository.PremiumInsightRepository;
import com.cropcopilot.advisor.repository.ProductRecommendationRepository;
import com.cropcopilot.advisor.repository.ProductRepository;
import com.cropcopilot.advisor.repository.RecommendationRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaComplianceDataStore implements ComplianceDataStore {

    private static final TypeReference<List<ComplianceCheckResult>> CHECK_LIST = new TypeReference<>() {
    };

    private final RecommendationRepository recommendationRepository;
    private final FieldInputRepository fieldInputRepository;
    private final ProductRecommendationRepository productRecommendationRepository;
    private final ProductRepository productRepository;
    private final ComplianceAuditLogRepository auditLogRepository;
    private final PremiumInsightRepository insightRepository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<ComplianceInput> loadInput(String recommendationId, String userId) {
        Optional<RecommendationEntity> recommendation = recommendationRepository.findByIdAndUserId(recommendationId, userId);
        if (recommendation.isEmpty()) {
            return Optional.empty();
        }

        Optional<FieldInputEntity> field = fieldInputRepository.findByIdAndUserId(
                recommendation.get().getInputId(), userId);
        if (field.isEmpty()) {
            log.warn("⚠️  Recommendation {} references missing input {}", recommendationId,
                    recommendation.get().getInputId());
        }

        return Optional.of(ComplianceInput.builder()
                .recommendationId(recommendationId)
                .userId(userId)
                .crop(field.map(FieldInputEntity::getCrop).orElse(null))
                .location(field.map(FieldInputEntity::getLocation).orElse(null))
                .season(field.map(FieldInputEntity::getSeason).orElse(null))
                .fieldAcreage(field.map(FieldInputEntity::getFieldAcreage).orElse(null))
                .plannedApplicationDate(field.map(FieldInputEntity::getPlannedApplicationDate).orElse(null))
                .products(loadProducts(recommendationId))
                .build());
    }

    private List<PlannedProduct> loadProducts(String recommendationId) {
        List<ProductRecommendationEntity> rows =
                productRecommendationRepository.findByRecommendationIdOrderByPriorityAsc(recommendationId);
        Map<String, ProductEntity> catalog = productRepository.findAllById(
                        rows.stream().map(ProductRecommendationEntity::getProductId).collect(Collectors.toList()))
                .stream()
                .collect(Collectors.toMap(ProductEntity::getId, Function.identity()));

        return rows.stream()
                .map(row -> {
                    ProductEntity product = catalog.get(row.getProductId());
                    return PlannedProduct.builder()
                            .productId(row.getProductId())
                            .productName(product == null ? null : product.getName())
                            .productType(product == null ? null : product.getProductType())
                            .applicationRate(row.getApplicationRate())
                            .reason(row.getReason())
                            .build();
                })
                .collect(Collectors.toList());
    }

    @Override
    @Transactional
    public void replaceAuditLog(ComplianceInput input, ComplianceEvaluation evaluation) {
        int removed = auditLogRepository.deleteByRecommendationId(input.getRecommendationId());
        String snapshot = toJson(inputSnapshot(input));

        List<ComplianceAuditLogEntity> rows = evaluation.getChecks().stream()
                .map(check -> ComplianceAuditLogEntity.builder()
                        .recommendationId(input.getRecommendationId())
                        .userId(input.getUserId())
                        .checkId(check.getId())
                        .ruleVersion(check.getRuleVersion())
                        .sourceVersion(check.getSourceVersion())
                        .inputSnapshot(snapshot)
                        .result(check.getResult().getValue())
                        .message(check.getMessage())
                        .evidence(toJson(check.getEvidence()))
                        .build())
                .collect(Collectors.toList());
        auditLogRepository.saveAll(rows);

        log.info("📝 Compliance audit for {}: replaced {} rows with {}", input.getRecommendationId(), removed, rows.size());
    }

    @Override
    @Transactional
    public void saveInsight(PremiumInsight insight) {
        PremiumInsightEntity entity = insightRepository.findById(insight.getRecommendationId())
                .orElseGet(() -> PremiumInsightEntity.builder()
                        .recommendationId(insight.getRecommendationId())
                        .build());
        entity.setUserId(insight.getUserId());
        entity.setStatus(insight.getStatus());
        entity.setRiskReview(insight.getRiskReview() == null ? null : insight.getRiskReview().getValue());
        entity.setChecks(toJson(insight.getChecks()));
        entity.setAdvisoryNotice(insight.getAdvisoryNotice());
        entity.setFailureReason(insight.getFailureReason());
        insightRepository.save(entity);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PremiumInsight> findInsight(String recommendationId, String userId) {
        return insightRepository.findById(recommendationId)
                .filter(entity -> entity.getUserId().equals(userId))
                .map(this::toInsight);
    }

    private PremiumInsight toInsight(PremiumInsightEntity entity) {
        return PremiumInsight.builder()
                .recommendationId(entity.getRecommendationId())
                .userId(entity.getUserId())
                .status(entity.getStatus())
                .riskReview(RiskReviewDecision.fromValue(entity.getRiskReview()))
                .checks(readChecks(entity))
                .advisoryNotice(entity.getAdvisoryNotice())
                .failureReason(entity.getFailureReason())
                .build();
    }

    private List<ComplianceCheckResult> readChecks(PremiumInsightEntity entity) {
        if (entity.getChecks() == null || entity.getChecks().isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(entity.getChecks(), CHECK_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored checks of insight " + entity.getRecommendationId() + " are unreadable", e);
        }
    }

    private static Map<String, Object> inputSnapshot(ComplianceInput input) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("crop", input.getCrop());
        snapshot.put("location", input.getLocation());
        snapshot.put("season", input.getSeason());
        snapshot.put("fieldAcreage", input.getFieldAcreage());
        snapshot.put("plannedApplicationDate",
                input.getPlannedApplicationDate() == null ? null : input.getPlannedApplicationDate().toString());
        snapshot.put("productCount", input.getProducts().size());
        return snapshot;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize compliance record", e);
        }
    }
}
