package com.cropcopilot.advisor.query;

import com.cropcopilot.advisor.model.retrieval.QueryExpansionResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Expands a symptom description into retrieval terms.
 *
 * <p>Tokens shorter than three characters and stopwords are dropped; known
 * agronomic terms pull in their synonyms; crop, region and growth stage are
 * appended as whole terms. Never fails: an input with no usable terms
 * expands to {@value #DEFAULT_TERM}.
 */
@Component
public class QueryExpander {

    public static final String DEFAULT_TERM = "crop diagnosis";

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
    private static final int MIN_TOKEN_LENGTH = 3;

    private static final Set<String> STOPWORDS = Set.of(
            "the", "and", "with", "from", "this", "that", "have", "has",
            "was", "were", "soil", "crop", "field");

    private static final Map<String, List<String>> SYNONYMS = Map.of(
            "blight", List.of("fungal disease", "leaf lesions"),
            "chlorosis", List.of("yellowing leaves", "nutrient deficiency"),
            "mildew", List.of("fungal disease", "humidity management"),
            "wilt", List.of("water stress", "vascular disease"),
            "aphid", List.of("insect pest", "sap-sucking insects"),
            "nitrogen", List.of("n deficiency", "leaf yellowing"),
            "potassium", List.of("k deficiency", "marginal scorch"));

    public QueryExpansionResult expand(String query) {
        return expand(query, null, null, null);
    }

    public QueryExpansionResult expand(String query, String crop, String region, String growthStage) {
        List<String> tokens = tokenize(query);
        Set<String> terms = new LinkedHashSet<>(tokens);

        for (String token : tokens) {
            List<String> synonyms = SYNONYMS.get(token);
            if (synonyms != null) {
                terms.addAll(synonyms);
            }
        }

        addContextTerm(terms, crop);
        addContextTerm(terms, region);
        addContextTerm(terms, growthStage);

        if (terms.isEmpty()) {
            terms.add(DEFAULT_TERM);
        }

        List<String> ordered = List.copyOf(terms);
        return new QueryExpansionResult(String.join(" ", ordered), ordered);
    }

    private static List<String> tokenize(String query) {
        List<String> tokens = new ArrayList<>();
        if (query == null) {
            return tokens;
        }
        for (String token : NON_ALPHANUMERIC.split(query.toLowerCase(Locale.ROOT))) {
            if (token.length() >= MIN_TOKEN_LENGTH && !STOPWORDS.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static void addContextTerm(Set<String> terms, String value) {
        if (value != null && !value.isBlank()) {
            terms.add(value.trim().toLowerCase(Locale.ROOT));
        }
    }
}
