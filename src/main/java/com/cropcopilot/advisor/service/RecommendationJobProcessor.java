package com.cropcopilot.advisor.service;

import com.cropcopilot.advisor.model.job.BatchProcessingResult;
import com.cropcopilot.advisor.model.job.RecommendationJobMessage;

import java.util.List;

/**
 * Consumes at-least-once job deliveries.
 *
 * <p>Each message is processed independently. Messages whose jobs are already
 * completed or currently running are skipped, so redelivery is harmless. The
 * returned result lists only the message ids the queue should redrive.
 */
public interface RecommendationJobProcessor {

    BatchProcessingResult processBatch(List<RecommendationJobMessage> messages);
}
