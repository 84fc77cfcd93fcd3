package com.cropcopilot.advisor.repository;

import com.cropcopilot.advisor.model.audit.PremiumInsightEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PremiumInsightRepository extends JpaRepository<PremiumInsightEntity, String> {
}
