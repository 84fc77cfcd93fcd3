package com.cropcopilot.advisor.repository;

import com.cropcopilot.advisor.model.corpus.ProductRecommendationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProductRecommendationRepository extends JpaRepository<ProductRecommendationEntity, Long> {

    List<ProductRecommendationEntity> findByRecommendationIdOrderByPriorityAsc(String recommendationId);

    @Modifying
    @Query("DELETE FROM ProductRecommendationEntity p WHERE p.recommendationId = :recommendationId")
    int deleteByRecommendationId(@Param("recommendationId") String recommendationId);
}
