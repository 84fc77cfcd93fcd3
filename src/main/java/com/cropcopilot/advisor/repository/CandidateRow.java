package com.cropcopilot.advisor.repository;

/**
 * Projection for the native corpus search queries. Aliases in the SQL are
 * quoted so the column labels keep this camel case.
 */
public interface CandidateRow {

    String getChunkId();

    String getContent();

    String getMetadata();

    String getSourceId();

    String getSourceTitle();

    String getSourceType();

    String getInstitution();

    Number getSimilarity();

    /**
     * Null for lexical rows.
     */
    Number getHybridScore();

    Number getSourceBoost();
}
