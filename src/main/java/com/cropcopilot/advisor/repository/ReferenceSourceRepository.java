package com.cropcopilot.advisor.repository;

import com.cropcopilot.advisor.model.corpus.ReferenceSourceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ReferenceSourceRepository extends JpaRepository<ReferenceSourceEntity, String> {

    List<ReferenceSourceEntity> findByStatus(String status);
}
