package com.cropcopilot.advisor.service.compliance;

import com.cropcopilot.advisor.model.job.RecommendationCompletedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the compliance stage once a recommendation job completes. A failure
 * here is logged against the trace and does not affect the finished job.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ComplianceEnrichmentListener {

    private final ComplianceEnrichmentService enrichmentService;

    @EventListener
    public void onRecommendationCompleted(RecommendationCompletedEvent event) {
        try {
            enrichmentService.enrich(event.getRecommendationId(), event.getUserId());
        } catch (RuntimeException e) {
            log.error("❌ Compliance enrichment for recommendation {} failed [trace={}]: {}",
                    event.getRecommendationId(), event.getTraceId(), e.getMessage(), e);
        }
    }
}
