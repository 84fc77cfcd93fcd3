package com.cropcopilot.advisor.service.compliance;

/**
 * Decides whether a user receives the compliance review stage.
 */
public interface EntitlementService {

    boolean isEntitled(String userId);
}
