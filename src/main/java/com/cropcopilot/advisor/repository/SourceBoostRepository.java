package com.cropcopilot.advisor.repository;

import com.cropcopilot.advisor.model.corpus.SourceBoostEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SourceBoostRepository extends JpaRepository<SourceBoostEntity, String> {
}
