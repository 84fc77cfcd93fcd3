package com.cropcopilot.advisor.search;

import com.cropcopilot.advisor.model.retrieval.RankedCandidate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maximal Marginal Relevance selection over an already ranked list.
 *
 * <p>Greedily picks the candidate maximising
 * {@code lambda * rankScore - (1 - lambda) * maxJaccard(selected)}, where
 * Jaccard similarity is taken over lowercase alphabetic tokens of four or
 * more letters. {@code lambda = 1} reproduces plain top-K; lower values
 * trade relevance for diversity.
 */
@Component
public class MmrDiversifier {

    public static final double DEFAULT_LAMBDA = 0.6;

    private static final Pattern WORD = Pattern.compile("\\b[a-z]{4,}\\b");

    public List<RankedCandidate> diversify(List<RankedCandidate> ranked, int topK) {
        return diversify(ranked, topK, DEFAULT_LAMBDA);
    }

    /**
     * @return at most {@code topK} candidates, or the input unchanged when it
     *         already has no more than {@code topK}
     */
    public List<RankedCandidate> diversify(List<RankedCandidate> ranked, int topK, double lambda) {
        if (ranked.size() <= topK) {
            return ranked;
        }

        List<RankedCandidate> remaining = new ArrayList<>(ranked);
        List<Set<String>> remainingTokens = new ArrayList<>(ranked.size());
        for (RankedCandidate candidate : ranked) {
            remainingTokens.add(tokenSet(candidate.getContent()));
        }

        List<RankedCandidate> selected = new ArrayList<>(topK);
        List<Set<String>> selectedTokens = new ArrayList<>(topK);

        while (selected.size() < topK && !remaining.isEmpty()) {
            int bestIndex = 0;
            double bestScore = Double.NEGATIVE_INFINITY;

            for (int i = 0; i < remaining.size(); i++) {
                double maxSimilarity = 0;
                for (Set<String> chosen : selectedTokens) {
                    maxSimilarity = Math.max(maxSimilarity, jaccard(remainingTokens.get(i), chosen));
                }
                double score = lambda * remaining.get(i).getRankScore() - (1 - lambda) * maxSimilarity;
                if (score > bestScore) {
                    bestScore = score;
                    bestIndex = i;
                }
            }

            selected.add(remaining.remove(bestIndex));
            selectedTokens.add(remainingTokens.remove(bestIndex));
        }
        return selected;
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0;
        }
        int intersection = 0;
        for (String token : a) {
            if (b.contains(token)) {
                intersection++;
            }
        }
        return (double) intersection / (a.size() + b.size() - intersection);
    }

    static Set<String> tokenSet(String text) {
        Set<String> tokens = new HashSet<>();
        if (text == null) {
            return tokens;
        }
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }
}
