package com.cropcopilot.advisor.model.retrieval;

import lombok.Value;

import java.util.List;

/**
 * Output of query expansion.
 *
 * <p>{@code terms} are lowercase, de-duplicated and kept in discovery order;
 * {@code expandedQuery} is the same terms joined with single spaces.
 */
@Value
public class QueryExpansionResult {
    String expandedQuery;
    List<String> terms;
}
