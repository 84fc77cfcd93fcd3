package com.cropcopilot.advisor.search;

import com.cropcopilot.advisor.model.retrieval.CandidateMetadata;
import com.cropcopilot.advisor.model.retrieval.RankContext;
import com.cropcopilot.advisor.model.retrieval.RankedCandidate;
import com.cropcopilot.advisor.model.retrieval.RetrievedCandidate;
import com.cropcopilot.advisor.model.retrieval.ScoreBreakdown;
import com.cropcopilot.advisor.model.retrieval.SourceType;
import com.cropcopilot.advisor.util.TextNormalizer;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Scores candidates on vector similarity, keyword coverage, source
 * authority and metadata fit, and sorts them by the weighted sum.
 *
 * <p>Pure and thread-safe. The sort is stable, so equal scores keep their
 * input order.
 */
@Component
public class HybridRanker {

    static final double CROP_MATCH = 0.4;
    static final double REGION_MATCH = 0.3;
    static final double TOPIC_MATCH = 0.15;
    static final double TOPIC_MATCH_CAP = 0.3;

    public List<RankedCandidate> rank(List<RetrievedCandidate> candidates, RankContext context) {
        List<String> terms = TextNormalizer.lowerAll(context.getQueryTerms());
        return candidates.stream()
                .map(candidate -> RankedCandidate.of(candidate, score(candidate, context, terms)))
                .sorted(Comparator.comparingDouble(RankedCandidate::getRankScore).reversed())
                .collect(Collectors.toList());
    }

    ScoreBreakdown score(RetrievedCandidate candidate, RankContext context, List<String> terms) {
        double vector = TextNormalizer.clamp(candidate.getSimilarity(), 0, 1);
        double keyword = keywordScore(candidate.getContent(), terms);
        SourceType sourceType = candidate.getSourceType() == null ? SourceType.OTHER : candidate.getSourceType();
        double metadata = metadataScore(candidate.getMetadata(), context);
        return new ScoreBreakdown(vector, keyword, sourceType.getAuthorityScore(), metadata);
    }

    static double keywordScore(String content, List<String> terms) {
        if (terms.isEmpty()) {
            return 0;
        }
        String normalized = TextNormalizer.lower(content);
        long matched = terms.stream().filter(normalized::contains).count();
        return (double) matched / terms.size();
    }

    static double metadataScore(CandidateMetadata metadata, RankContext context) {
        if (metadata == null) {
            return 0;
        }
        double score = 0;

        String crop = TextNormalizer.lower(context.getCrop());
        if (!crop.isEmpty() && TextNormalizer.lowerAll(metadata.cropsOrEmpty()).contains(crop)) {
            score += CROP_MATCH;
        }

        String region = TextNormalizer.lower(context.getRegion());
        String candidateRegion = TextNormalizer.lower(metadata.getRegion());
        if (!region.isEmpty() && !candidateRegion.isEmpty() && candidateRegion.contains(region)) {
            score += REGION_MATCH;
        }

        List<String> hints = TextNormalizer.lowerAll(context.getTopicHints());
        List<String> topics = TextNormalizer.lowerAll(metadata.topicsOrEmpty());
        if (!hints.isEmpty() && !topics.isEmpty()) {
            long matched = topics.stream().filter(hints::contains).count();
            score += Math.min(TOPIC_MATCH_CAP, matched * TOPIC_MATCH);
        }

        return Math.min(1, score);
    }
}
