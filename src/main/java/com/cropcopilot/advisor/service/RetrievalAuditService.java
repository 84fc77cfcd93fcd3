package com.cropcopilot.advisor.service;

import com.cropcopilot.advisor.model.audit.RetrievalAuditRecord;

/**
 * Append-only retrieval audit trail, one record per recommendation.
 */
public interface RetrievalAuditService {

    /**
     * Similarity at or above which an uncited candidate counts as missed.
     */
    double MISSED_SIMILARITY_THRESHOLD = 0.45;

    /**
     * Number of query terms kept on the record.
     */
    int MAX_TOPICS = 12;

    /**
     * Write the audit row for a recommendation. A second call for the same
     * recommendation id leaves the first row untouched.
     */
    void record(RetrievalAuditRecord record);
}
