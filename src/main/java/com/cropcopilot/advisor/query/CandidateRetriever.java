package com.cropcopilot.advisor.query;

import com.cropcopilot.advisor.configuration.AppProperties;
import com.cropcopilot.advisor.configuration.RetrievalProperties;
import com.cropcopilot.advisor.knowledge.EmbeddingService;
import com.cropcopilot.advisor.knowledge.ReferenceCorpusStore;
import com.cropcopilot.advisor.model.corpus.CorpusPassage;
import com.cropcopilot.advisor.model.retrieval.QueryExpansionResult;
import com.cropcopilot.advisor.model.retrieval.RetrievedCandidate;
import com.cropcopilot.advisor.model.retrieval.SourceType;
import com.cropcopilot.advisor.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Pulls rank-eligible passages from the reference corpus.
 *
 * <p>Vector search is used whenever an embedding can be produced for the
 * expanded query. Otherwise, or when the vector path yields nothing usable,
 * a lexical term-coverage search runs instead. Embedding failures never
 * escape this class; datastore failures do.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CandidateRetriever {

    static final int MIN_CONTENT_LENGTH = 80;
    static final double MIN_ALPHA_RATIO = 0.55;
    static final double LEXICAL_SCORE_CAP = 0.95;
    static final double LEXICAL_MIN_SCORE = 0.2;
    static final double LEXICAL_CROP_BOOST = 0.2;
    static final double MIN_SOURCE_BOOST = -0.1;
    static final double MAX_SOURCE_BOOST = 0.25;
    static final int LEXICAL_FETCH_FACTOR = 5;

    private final EmbeddingService embeddingService;
    private final ReferenceCorpusStore corpusStore;
    private final AppProperties props;

    /**
     * @param expansion expanded query terms
     * @param crop      the grower's crop, used for boosts; may be null
     */
    public List<RetrievedCandidate> retrieve(QueryExpansionResult expansion, String crop) {
        int limit = props.getRetrieval().getLimit();

        Optional<List<Double>> embedding = embeddingService.embed(expansion.getExpandedQuery());
        if (embedding.isEmpty()) {
            log.warn("⚠️  No query embedding available, using lexical retrieval");
            return retrieveLexical(expansion, crop, limit);
        }

        List<RetrievedCandidate> candidates = corpusStore
                .searchByVector(embedding.get(), crop == null ? "" : crop, limit * 2)
                .stream()
                .map(passage -> toCandidate(passage, vectorSimilarity(passage)))
                .filter(candidate -> !isLowSignalContent(candidate.getContent()))
                .collect(Collectors.toList());

        if (!candidates.isEmpty()) {
            log.info("🔎 Vector retrieval returned {} candidates", candidates.size());
            return candidates;
        }

        log.warn("⚠️  Vector retrieval returned no usable candidates, using lexical retrieval");
        return retrieveLexical(expansion, crop, limit);
    }

    List<RetrievedCandidate> retrieveLexical(QueryExpansionResult expansion, String crop, int limit) {
        RetrievalProperties retrieval = props.getRetrieval();
        List<String> terms = expansion.getTerms().stream()
                .map(term -> term.toLowerCase(Locale.ROOT).trim())
                .filter(term -> term.length() >= retrieval.getMinLexicalTermLength())
                .limit(retrieval.getLexicalTermCap())
                .collect(Collectors.toList());
        if (terms.isEmpty()) {
            log.info("🔎 No lexical terms long enough to search");
            return List.of();
        }

        String cropTerm = TextNormalizer.lower(crop).trim();
        List<RetrievedCandidate> candidates = corpusStore.searchByTerms(terms, limit * LEXICAL_FETCH_FACTOR)
                .stream()
                .map(passage -> toCandidate(passage, lexicalScore(passage, terms, cropTerm)))
                .filter(candidate -> candidate.getSimilarity() > LEXICAL_MIN_SCORE)
                .filter(candidate -> !isLowSignalContent(candidate.getContent()))
                .sorted(Comparator.comparingDouble(RetrievedCandidate::getSimilarity).reversed())
                .limit(limit)
                .collect(Collectors.toList());

        log.info("🔎 Lexical retrieval returned {} candidates for {} terms", candidates.size(), terms.size());
        return candidates;
    }

    private static double vectorSimilarity(CorpusPassage passage) {
        double score = Double.isFinite(passage.getHybridScore())
                ? passage.getHybridScore()
                : passage.getSimilarity();
        return TextNormalizer.clamp(score, 0, 1);
    }

    static double lexicalScore(CorpusPassage passage, List<String> terms, String cropTerm) {
        String content = TextNormalizer.normalizeWhitespace(passage.getContent()).toLowerCase(Locale.ROOT);
        long matched = terms.stream().filter(content::contains).count();
        double coverage = (double) matched / terms.size();

        boolean cropMatch = !cropTerm.isEmpty()
                && (content.contains(cropTerm)
                || TextNormalizer.lower(passage.getSourceTitle()).contains(cropTerm)
                || TextNormalizer.lower(passage.getRawMetadata()).contains(cropTerm));
        double cropBoost = cropMatch ? LEXICAL_CROP_BOOST : 0;
        double sourceBoost = TextNormalizer.clamp(passage.getSourceBoost(), MIN_SOURCE_BOOST, MAX_SOURCE_BOOST);

        return Math.min(LEXICAL_SCORE_CAP, coverage + cropBoost + sourceBoost);
    }

    /**
     * Too short, or mostly digits and punctuation (tables, headers, page furniture).
     */
    static boolean isLowSignalContent(String content) {
        String normalized = TextNormalizer.normalizeWhitespace(content);
        if (normalized.length() < MIN_CONTENT_LENGTH) {
            return true;
        }
        long alpha = normalized.chars()
                .filter(c -> (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z'))
                .count();
        return (double) alpha / normalized.length() < MIN_ALPHA_RATIO;
    }

    private static RetrievedCandidate toCandidate(CorpusPassage passage, double similarity) {
        return RetrievedCandidate.builder()
                .chunkId(passage.getChunkId())
                .sourceId(passage.getSourceId())
                .content(TextNormalizer.normalizeWhitespace(passage.getContent()))
                .similarity(TextNormalizer.clamp(similarity, 0, 1))
                .sourceType(SourceType.fromValue(passage.getSourceType()))
                .sourceTitle(passage.getSourceTitle())
                .metadata(passage.getMetadata())
                .build();
    }
}
