package com.cropcopilot.advisor.repository;

import com.cropcopilot.advisor.model.job.RecommendationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface RecommendationRepository extends JpaRepository<RecommendationEntity, String> {

    Optional<RecommendationEntity> findByIdAndUserId(String id, String userId);

    Optional<RecommendationEntity> findByJobId(String jobId);
}
