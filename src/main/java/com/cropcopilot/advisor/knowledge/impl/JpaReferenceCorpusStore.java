package com.cropcopilot.advisor.knowledge.impl;

import com.cropcopilot.advisor.knowledge.ReferenceCorpusStore;
import com.cropcopilot.advisor.model.CallContext;
import com.cropcopilot.advisor.model.ServiceType;
import com.cropcopilot.advisor.model.corpus.CorpusPassage;
import com.cropcopilot.advisor.model.retrieval.CandidateMetadata;
import com.cropcopilot.advisor.repository.CandidateRow;
import com.cropcopilot.advisor.repository.TextChunkRepository;
import com.cropcopilot.advisor.util.ExternalCallLogger;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaReferenceCorpusStore implements ReferenceCorpusStore {

    private final TextChunkRepository textChunkRepository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(readOnly = true)
    public List<CorpusPassage> searchByVector(List<Double> embedding, String cropTerm, int limit) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.POSTGRES, "searchByVector", log);
        ctx.logRequest(embedding.size() + " dims", "Crop", cropTerm, "Limit", limit);
        try {
            List<CandidateRow> rows = textChunkRepository.searchByVector(
                    toVectorLiteral(embedding), cropTerm == null ? "" : cropTerm, limit);
            ctx.logResponse(rows.size() + " rows");
            return rows.stream().map(this::toPassage).collect(Collectors.toList());
        } catch (DataAccessException e) {
            ctx.logError("Vector search failed", e);
            throw e;
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<CorpusPassage> searchByTerms(List<String> terms, int limit) {
        if (terms.isEmpty()) {
            return List.of();
        }
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.POSTGRES, "searchByTerms", log);
        ctx.logRequest(String.join(", ", terms), "Limit", limit);
        try {
            List<CandidateRow> rows = textChunkRepository.searchByPattern(toAlternation(terms), limit);
            ctx.logResponse(rows.size() + " rows");
            return rows.stream().map(this::toPassage).collect(Collectors.toList());
        } catch (DataAccessException e) {
            ctx.logError("Lexical search failed", e);
            throw e;
        }
    }

    /**
     * pgvector text literal, e.g. {@code [0.1,0.2]}.
     */
    public static String toVectorLiteral(List<Double> embedding) {
        return embedding.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(",", "[", "]"));
    }

    /**
     * POSIX regex matching any of the terms literally.
     */
    static String toAlternation(List<String> terms) {
        return terms.stream()
                .map(JpaReferenceCorpusStore::escapeRegex)
                .collect(Collectors.joining("|"));
    }

    private static String escapeRegex(String term) {
        return term.replaceAll("[\\\\.\\[\\]{}()*+?^$|]", "\\\\$0");
    }

    private CorpusPassage toPassage(CandidateRow row) {
        return CorpusPassage.builder()
                .chunkId(row.getChunkId())
                .sourceId(row.getSourceId())
                .content(row.getContent())
                .sourceTitle(row.getSourceTitle())
                .sourceType(row.getSourceType())
                .institution(row.getInstitution())
                .rawMetadata(row.getMetadata())
                .metadata(parseMetadata(row.getChunkId(), row.getMetadata()))
                .similarity(toDouble(row.getSimilarity(), 0))
                .hybridScore(toDouble(row.getHybridScore(), Double.NaN))
                .sourceBoost(toDouble(row.getSourceBoost(), 0))
                .build();
    }

    private CandidateMetadata parseMetadata(String chunkId, String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, CandidateMetadata.class);
        } catch (JsonProcessingException e) {
            log.warn("⚠️  Ignoring malformed metadata on chunk {}: {}", chunkId, e.getOriginalMessage());
            return null;
        }
    }

    private static double toDouble(Number value, double fallback) {
        return value == null ? fallback : value.doubleValue();
    }
}
