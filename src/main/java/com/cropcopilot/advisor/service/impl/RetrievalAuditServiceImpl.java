package com.cropcopilot.advisor.service.impl;

import com.cropcopilot.advisor.model.audit.AuditedChunk;
import com.cropcopilot.advisor.model.audit.RetrievalAuditEntity;
import com.cropcopilot.advisor.model.audit.RetrievalAuditRecord;
import com.cropcopilot.advisor.model.retrieval.RankedCandidate;
import com.cropcopilot.advisor.repository.RetrievalAuditRepository;
import com.cropcopilot.advisor.service.RetrievalAuditService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class RetrievalAuditServiceImpl implements RetrievalAuditService {

    private final RetrievalAuditRepository auditRepository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional
    public void record(RetrievalAuditRecord record) {
        if (auditRepository.existsByRecommendationId(record.getRecommendationId())) {
            log.info("Retrieval audit for {} already exists, leaving it untouched", record.getRecommendationId());
            return;
        }

        Set<String> cited = new HashSet<>(record.getCitedChunkIds());
        List<AuditedChunk> candidateChunks = record.getCandidates().stream()
                .map(candidate -> toAuditedChunk(candidate, cited.contains(candidate.getChunkId())))
                .collect(Collectors.toList());
        List<AuditedChunk> used = candidateChunks.stream()
                .filter(AuditedChunk::isCited)
                .collect(Collectors.toList());
        List<AuditedChunk> missed = candidateChunks.stream()
                .filter(chunk -> !chunk.isCited() && chunk.getSimilarity() >= MISSED_SIMILARITY_THRESHOLD)
                .collect(Collectors.toList());

        RetrievalAuditEntity entity = RetrievalAuditEntity.builder()
                .id(UUID.randomUUID().toString())
                .inputId(record.getInputId())
                .recommendationId(record.getRecommendationId())
                .query(record.getQuery())
                .topics(toJson(record.getQueryTerms().stream().limit(MAX_TOPICS).collect(Collectors.toList())))
                .candidateChunks(toJson(candidateChunks))
                .usedChunks(toJson(used))
                .missedChunks(toJson(missed))
                .imageLinks(toJson(record.getImageLinks()))
                .build();

        auditRepository.save(entity);
        log.info("📝 Retrieval audit stored for {}: {} candidates, {} used, {} missed",
                record.getRecommendationId(), candidateChunks.size(), used.size(), missed.size());
    }

    private static AuditedChunk toAuditedChunk(RankedCandidate candidate, boolean cited) {
        return AuditedChunk.builder()
                .id(candidate.getChunkId())
                .sourceId(candidate.getSourceId())
                .similarity(candidate.getSimilarity())
                .rankScore(candidate.getRankScore())
                .sourceType(candidate.getSourceType().getValue())
                .cited(cited)
                .assembled(true)
                .type("text")
                .build();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize retrieval audit field", e);
        }
    }
}
