package com.cropcopilot.advisor.repository;

import com.cropcopilot.advisor.model.job.JobStatus;
import com.cropcopilot.advisor.model.job.RecommendationJobEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RecommendationJobRepository extends JpaRepository<RecommendationJobEntity, String> {

    Optional<RecommendationJobEntity> findByIdAndUserId(String id, String userId);

    List<RecommendationJobEntity> findByStatusOrderByCreatedAtAsc(JobStatus status);
}
