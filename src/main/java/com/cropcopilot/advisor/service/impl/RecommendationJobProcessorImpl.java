package com.cropcopilot.advisor.service.impl;

import com.cropcopilot.advisor.exception.RecommendationJobNotFoundException;
import com.cropcopilot.advisor.model.job.BatchProcessingResult;
import com.cropcopilot.advisor.model.job.JobStatus;
import com.cropcopilot.advisor.model.job.RecommendationCompletedEvent;
import com.cropcopilot.advisor.model.job.RecommendationJobEntity;
import com.cropcopilot.advisor.model.job.RecommendationJobMessage;
import com.cropcopilot.advisor.model.recommendation.RecommendationRequest;
import com.cropcopilot.advisor.model.recommendation.RecommendationResult;
import com.cropcopilot.advisor.repository.RecommendationJobRepository;
import com.cropcopilot.advisor.service.RecommendationJobProcessor;
import com.cropcopilot.advisor.service.RecommendationPipeline;
import com.cropcopilot.advisor.service.RecommendationResultStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class RecommendationJobProcessorImpl implements RecommendationJobProcessor {

    static final int MAX_FAILURE_REASON_LENGTH = 4000;

    private final RecommendationJobRepository jobRepository;
    private final RecommendationPipeline pipeline;
    private final RecommendationResultStore resultStore;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    public BatchProcessingResult processBatch(List<RecommendationJobMessage> messages) {
        log.info("📬 Processing batch of {} recommendation job messages", messages.size());

        List<String> failed = new ArrayList<>();
        int completed = 0;
        int skipped = 0;

        for (RecommendationJobMessage message : messages) {
            long start = System.currentTimeMillis();
            try {
                if (process(message)) {
                    completed++;
                    log.info("✅ Job {} completed in {}ms [trace={}]",
                            message.getJobId(), System.currentTimeMillis() - start, message.getTraceId());
                } else {
                    skipped++;
                }
            } catch (RuntimeException e) {
                log.error("❌ Failed to process message {} for job {} [trace={}]: {}",
                        message.getMessageId(), message.getJobId(), message.getTraceId(), e.getMessage(), e);
                markFailed(message, e);
                failed.add(message.getMessageId());
            }
        }

        log.info("📊 Batch finished: {} completed, {} skipped, {} failed", completed, skipped, failed.size());
        return new BatchProcessingResult(failed, completed, skipped);
    }

    /**
     * @return false when the delivery was a duplicate and nothing ran
     */
    private boolean process(RecommendationJobMessage message) {
        RecommendationJobEntity job = jobRepository.findByIdAndUserId(message.getJobId(), message.getUserId())
                .orElseThrow(() -> new RecommendationJobNotFoundException(message.getJobId()));

        if (job.getStatus() == JobStatus.COMPLETED) {
            log.info("⏭️  Job {} already completed, ignoring redelivery {}", job.getId(), message.getMessageId());
            return false;
        }
        if (!job.getStatus().isStartable()) {
            log.info("⏭️  Job {} is {} in another worker, ignoring duplicate delivery {}",
                    job.getId(), job.getStatus(), message.getMessageId());
            return false;
        }

        job.setFailureReason(null);
        job = transition(job, JobStatus.RETRIEVING_CONTEXT);
        job = transition(job, JobStatus.GENERATING_RECOMMENDATION);
        job = transition(job, JobStatus.VALIDATING_OUTPUT);

        RecommendationResult result = pipeline.run(
                new RecommendationRequest(message.getInputId(), message.getUserId(), message.getJobId()));

        resultStore.save(message.getJobId(), message.getUserId(), result);
        job = transition(job, JobStatus.PERSISTING_RESULT);
        job.setRecommendationId(result.getRecommendationId());
        transition(job, JobStatus.COMPLETED);

        eventPublisher.publishEvent(new RecommendationCompletedEvent(
                result.getRecommendationId(), message.getUserId(), message.getJobId(), message.getTraceId()));
        return true;
    }

    private RecommendationJobEntity transition(RecommendationJobEntity job, JobStatus status) {
        log.debug("Job {}: {} -> {}", job.getId(), job.getStatus(), status);
        job.setStatus(status);
        return jobRepository.save(job);
    }

    private void markFailed(RecommendationJobMessage message, RuntimeException cause) {
        try {
            jobRepository.findByIdAndUserId(message.getJobId(), message.getUserId()).ifPresent(job -> {
                job.setStatus(JobStatus.FAILED);
                job.setFailureReason(failureReason(cause));
                jobRepository.save(job);
            });
        } catch (DataAccessException e) {
            log.error("❌ Could not mark job {} as failed: {}", message.getJobId(), e.getMessage(), e);
        }
    }

    private static String failureReason(RuntimeException cause) {
        String reason = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return reason.length() <= MAX_FAILURE_REASON_LENGTH ? reason : reason.substring(0, MAX_FAILURE_REASON_LENGTH);
    }
}
