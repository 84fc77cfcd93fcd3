package com.cropcopilot.advisor.model.compliance;

public enum InsightStatus {
    NOT_AVAILABLE,
    QUEUED,
    PROCESSING,
    READY,
    FAILED
}
