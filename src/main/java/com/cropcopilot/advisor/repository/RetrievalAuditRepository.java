package com.cropcopilot.advisor.repository;

import com.cropcopilot.advisor.model.audit.RetrievalAuditEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Append-only retrieval audit trail.
 */
@Repository
public interface RetrievalAuditRepository extends JpaRepository<RetrievalAuditEntity, String> {

    Optional<RetrievalAuditEntity> findByRecommendationId(String recommendationId);

    boolean existsByRecommendationId(String recommendationId);

    List<RetrievalAuditEntity> findByInputIdOrderByCreatedAtDesc(String inputId);
}
