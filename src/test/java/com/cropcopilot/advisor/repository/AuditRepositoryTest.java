package com.cropcopilot.advisor.repository;

import com.cropcopilot.advisor.model.audit.ComplianceAuditLogEntity;
import com.cropcopilot.advisor.model.audit.RetrievalAuditEntity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@DisplayName("Audit Repository Tests")
class AuditRepositoryTest {

    @Autowired
    private RetrievalAuditRepository retrievalAuditRepository;

    @Autowired
    private ComplianceAuditLogRepository complianceAuditLogRepository;

    @Test
    @DisplayName("Only one retrieval audit may exist per recommendation")
    void testRetrievalAudit_UniquePerRecommendation() {
        // Given
        retrievalAuditRepository.saveAndFlush(retrievalAudit("a-1", "rec-1"));

        // Then
        assertTrue(retrievalAuditRepository.existsByRecommendationId("rec-1"));
        assertEquals("a-1", retrievalAuditRepository.findByRecommendationId("rec-1").orElseThrow().getId());
        assertThrows(DataIntegrityViolationException.class,
                () -> retrievalAuditRepository.saveAndFlush(retrievalAudit("a-2", "rec-1")));
    }

    @Test
    @DisplayName("Deleting by recommendation should remove only that check set")
    void testComplianceAuditLog_DeleteByRecommendation() {
        // Given
        complianceAuditLogRepository.saveAll(List.of(
                auditLog("rec-1", "max_single_rate"),
                auditLog("rec-1", "rei_phi_window"),
                auditLog("rec-2", "max_single_rate")));
        complianceAuditLogRepository.flush();

        // When
        int deleted = complianceAuditLogRepository.deleteByRecommendationId("rec-1");

        // Then
        assertEquals(2, deleted);
        assertTrue(complianceAuditLogRepository.findByRecommendationIdOrderByIdAsc("rec-1").isEmpty());
        assertEquals(1, complianceAuditLogRepository.findByRecommendationIdOrderByIdAsc("rec-2").size());
    }

    private static RetrievalAuditEntity retrievalAudit(String id, String recommendationId) {
        return RetrievalAuditEntity.builder()
                .id(id)
                .inputId("input-1")
                .recommendationId(recommendationId)
                .query("corn leaf spot")
                .topics("[\"corn\"]")
                .candidateChunks("[]")
                .usedChunks("[]")
                .missedChunks("[]")
                .build();
    }

    private static ComplianceAuditLogEntity auditLog(String recommendationId, String checkId) {
        return ComplianceAuditLogEntity.builder()
                .recommendationId(recommendationId)
                .userId("user-1")
                .checkId(checkId)
                .ruleVersion("risk-review-rules-v2")
                .sourceVersion("heuristic-local-v1-no-regulatory-feed")
                .result("clear_signal")
                .message("ok")
                .evidence("{}")
                .build();
    }
}
