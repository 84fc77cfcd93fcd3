package com.cropcopilot.advisor.repository;

import com.cropcopilot.advisor.model.intake.FieldInputEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface FieldInputRepository extends JpaRepository<FieldInputEntity, String> {

    /**
     * Input scoped to its owner; another user's input is treated as missing.
     */
    Optional<FieldInputEntity> findByIdAndUserId(String id, String userId);
}
