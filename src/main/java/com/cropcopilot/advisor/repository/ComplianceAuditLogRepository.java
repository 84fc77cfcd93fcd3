package com.cropcopilot.advisor.repository;

import com.cropcopilot.advisor.model.audit.ComplianceAuditLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ComplianceAuditLogRepository extends JpaRepository<ComplianceAuditLogEntity, Long> {

    List<ComplianceAuditLogEntity> findByRecommendationIdOrderByIdAsc(String recommendationId);

    /**
     * Bulk delete so a re-evaluation replaces the whole check set.
     */
    @Modifying
    @Query("DELETE FROM ComplianceAuditLogEntity c WHERE c.recommendationId = :recommendationId")
    int deleteByRecommendationId(@Param("recommendationId") String recommendationId);
}
