package com.cropcopilot.advisor.service.impl;

import com.cropcopilot.advisor.exception.InputNotFoundException;
import com.cropcopilot.advisor.model.job.BatchProcessingResult;
import com.cropcopilot.advisor.model.job.JobStatus;
import com.cropcopilot.advisor.model.job.RecommendationCompletedEvent;
import com.cropcopilot.advisor.model.job.RecommendationJobEntity;
import com.cropcopilot.advisor.model.job.RecommendationJobMessage;
import com.cropcopilot.advisor.model.recommendation.RecommendationRequest;
import com.cropcopilot.advisor.model.recommendation.RecommendationResult;
import com.cropcopilot.advisor.repository.RecommendationJobRepository;
import com.cropcopilot.advisor.service.RecommendationPipeline;
import com.cropcopilot.advisor.service.RecommendationResultStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Recommendation Job Processor Tests")
class RecommendationJobProcessorImplTest {

    @Mock
    private RecommendationJobRepository jobRepository;

    @Mock
    private RecommendationPipeline pipeline;

    @Mock
    private RecommendationResultStore resultStore;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private RecommendationJobProcessorImpl processor;

    private final List<JobStatus> savedStatuses = new ArrayList<>();

    @BeforeEach
    void setUp() {
        processor = new RecommendationJobProcessorImpl(jobRepository, pipeline, resultStore, eventPublisher);
    }

    @Test
    @DisplayName("Queued job should move through every stage, store the result and publish completion")
    void testProcessBatch_ShouldCompleteQueuedJob() {
        // Given
        RecommendationJobEntity job = job("job-1", JobStatus.QUEUED);
        RecommendationResult result = RecommendationResult.builder().recommendationId("rec-1").modelUsed("heuristic-rag-v1").build();
        when(jobRepository.findByIdAndUserId("job-1", "user-1")).thenReturn(Optional.of(job));
        recordSaves();
        when(pipeline.run(new RecommendationRequest("input-1", "user-1", "job-1"))).thenReturn(result);

        // When
        BatchProcessingResult batch = processor.processBatch(List.of(message("m-1", "job-1")));

        // Then
        assertFalse(batch.hasFailures());
        assertEquals(1, batch.getCompleted());
        assertEquals(List.of(JobStatus.RETRIEVING_CONTEXT, JobStatus.GENERATING_RECOMMENDATION,
                JobStatus.VALIDATING_OUTPUT, JobStatus.PERSISTING_RESULT, JobStatus.COMPLETED), savedStatuses);
        assertEquals("rec-1", job.getRecommendationId());
        verify(resultStore).save("job-1", "user-1", result);

        ArgumentCaptor<RecommendationCompletedEvent> event = ArgumentCaptor.forClass(RecommendationCompletedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertEquals("rec-1", event.getValue().getRecommendationId());
        assertEquals("trace-m-1", event.getValue().getTraceId());
    }

    @Test
    @DisplayName("Redelivered completed job and in-flight job should be skipped without side effects")
    void testProcessBatch_ShouldSkipDuplicates() {
        // Given
        when(jobRepository.findByIdAndUserId("job-done", "user-1"))
                .thenReturn(Optional.of(job("job-done", JobStatus.COMPLETED)));
        when(jobRepository.findByIdAndUserId("job-busy", "user-1"))
                .thenReturn(Optional.of(job("job-busy", JobStatus.GENERATING_RECOMMENDATION)));

        // When
        BatchProcessingResult batch = processor.processBatch(
                List.of(message("m-1", "job-done"), message("m-2", "job-busy")));

        // Then
        assertEquals(2, batch.getSkipped());
        assertEquals(0, batch.getCompleted());
        assertTrue(batch.getFailedMessageIds().isEmpty());
        verify(jobRepository, never()).save(any());
        verifyNoInteractions(pipeline, resultStore, eventPublisher);
    }

    @Test
    @DisplayName("Pipeline failure should mark the job FAILED and report only that message")
    void testProcessBatch_FailureShouldBeReported() {
        // Given
        RecommendationJobEntity failing = job("job-1", JobStatus.QUEUED);
        RecommendationJobEntity healthy = job("job-2", JobStatus.FAILED);
        when(jobRepository.findByIdAndUserId("job-1", "user-1")).thenReturn(Optional.of(failing));
        when(jobRepository.findByIdAndUserId("job-2", "user-1")).thenReturn(Optional.of(healthy));
        recordSaves();
        when(pipeline.run(any())).thenAnswer(invocation -> {
            RecommendationRequest request = invocation.getArgument(0);
            if (request.getJobId().equals("job-1")) {
                throw new InputNotFoundException("input-1");
            }
            return RecommendationResult.builder().recommendationId("rec-2").build();
        });

        // When
        BatchProcessingResult batch = processor.processBatch(
                List.of(message("m-1", "job-1"), message("m-2", "job-2")));

        // Then
        assertEquals(List.of("m-1"), batch.getFailedMessageIds());
        assertEquals(1, batch.getCompleted());
        assertEquals(JobStatus.FAILED, failing.getStatus());
        assertEquals("Input snapshot was not found for inputId=input-1", failing.getFailureReason());
        assertEquals(JobStatus.COMPLETED, healthy.getStatus());
        assertNull(healthy.getFailureReason());
        verify(eventPublisher, times(1)).publishEvent(any(RecommendationCompletedEvent.class));
    }

    @Test
    @DisplayName("Unknown job should be reported as failed")
    void testProcessBatch_MissingJob() {
        when(jobRepository.findByIdAndUserId("ghost", "user-1")).thenReturn(Optional.empty());

        BatchProcessingResult batch = processor.processBatch(List.of(message("m-9", "ghost")));

        assertEquals(List.of("m-9"), batch.getFailedMessageIds());
        verify(jobRepository, never()).save(any());
        verifyNoInteractions(pipeline);
    }

    @Test
    @DisplayName("Very long failure reasons should be truncated to the column size")
    void testProcessBatch_FailureReasonTruncated() {
        RecommendationJobEntity failing = job("job-1", JobStatus.QUEUED);
        when(jobRepository.findByIdAndUserId("job-1", "user-1")).thenReturn(Optional.of(failing));
        recordSaves();
        when(pipeline.run(any())).thenThrow(new IllegalStateException("x".repeat(5000)));

        processor.processBatch(List.of(message("m-1", "job-1")));

        assertEquals(RecommendationJobProcessorImpl.MAX_FAILURE_REASON_LENGTH, failing.getFailureReason().length());
    }

    private void recordSaves() {
        when(jobRepository.save(any(RecommendationJobEntity.class))).thenAnswer(invocation -> {
            RecommendationJobEntity saved = invocation.getArgument(0);
            savedStatuses.add(saved.getStatus());
            return saved;
        });
    }

    private static RecommendationJobEntity job(String id, JobStatus status) {
        return RecommendationJobEntity.builder()
                .id(id)
                .userId("user-1")
                .inputId("input-1")
                .status(status)
                .failureReason(status == JobStatus.FAILED ? "previous attempt timed out" : null)
                .build();
    }

    private static RecommendationJobMessage message(String messageId, String jobId) {
        return RecommendationJobMessage.builder()
                .messageId(messageId)
                .jobId(jobId)
                .inputId("input-1")
                .userId("user-1")
                .traceId("trace-" + messageId)
                .build();
    }
}
