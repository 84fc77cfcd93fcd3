package com.cropcopilot.advisor.model.job;

import lombok.Value;

import java.util.List;

/**
 * Per-batch outcome reported back to the queue. Only the messages listed in
 * {@code failedMessageIds} should be redelivered.
 */
@Value
public class BatchProcessingResult {
    List<String> failedMessageIds;
    int completed;
    int skipped;

    public boolean hasFailures() {
        return !failedMessageIds.isEmpty();
    }
}
