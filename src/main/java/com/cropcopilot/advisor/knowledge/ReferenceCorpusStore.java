package com.cropcopilot.advisor.knowledge;

import com.cropcopilot.advisor.model.corpus.CorpusPassage;

import java.util.List;

/**
 * Read-only query surface over the reference corpus. Only passages of
 * sources in a searchable state are returned.
 *
 * Datastore failures propagate as {@link org.springframework.dao.DataAccessException}.
 */
public interface ReferenceCorpusStore {

    /**
     * Passages nearest to {@code embedding}, ordered by hybrid score.
     *
     * @param embedding query vector
     * @param cropTerm  crop name for the substring boost, may be blank
     * @param limit     maximum rows
     */
    List<CorpusPassage> searchByVector(List<Double> embedding, String cropTerm, int limit);

    /**
     * Passages whose content, source title or metadata contain at least one
     * of {@code terms}, newest first. Similarity is 0 on every row.
     */
    List<CorpusPassage> searchByTerms(List<String> terms, int limit);
}
