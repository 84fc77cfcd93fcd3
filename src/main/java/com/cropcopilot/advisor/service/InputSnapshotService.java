package com.cropcopilot.advisor.service;

import com.cropcopilot.advisor.model.recommendation.InputSnapshot;

import java.util.Optional;

/**
 * Read access to grower submissions owned by intake.
 */
public interface InputSnapshotService {

    /**
     * Load the submission, scoped to its owner.
     *
     * @return empty when no input with that id belongs to {@code userId}
     */
    Optional<InputSnapshot> load(String inputId, String userId);
}
