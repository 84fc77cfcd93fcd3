package com.cropcopilot.advisor.search;

import com.cropcopilot.advisor.model.retrieval.CandidateMetadata;
import com.cropcopilot.advisor.model.retrieval.RankContext;
import com.cropcopilot.advisor.model.retrieval.RankedCandidate;
import com.cropcopilot.advisor.model.retrieval.RetrievedCandidate;
import com.cropcopilot.advisor.model.retrieval.ScoreBreakdown;
import com.cropcopilot.advisor.model.retrieval.SourceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Hybrid Ranker Tests")
class HybridRankerTest {

    private final HybridRanker ranker = new HybridRanker();

    private final RankContext context = RankContext.builder()
            .queryTerms(List.of("nitrogen", "yellowing", "corn"))
            .crop("Corn")
            .region("Iowa")
            .topicHints(List.of("fertility"))
            .build();

    @Test
    @DisplayName("Government source should outrank retailer with identical other signals")
    void testRank_GovernmentShouldOutrankRetailer() {
        // Given
        RetrievedCandidate retailer = candidate("c-retail", SourceType.RETAILER, 0.7);
        RetrievedCandidate government = candidate("c-gov", SourceType.GOVERNMENT, 0.7);

        // When
        List<RankedCandidate> ranked = ranker.rank(List.of(retailer, government), context);

        // Then
        assertEquals("c-gov", ranked.get(0).getChunkId());
        assertTrue(ranked.get(0).getRankScore() > ranked.get(1).getRankScore());
    }

    @Test
    @DisplayName("All score components and the rank score should stay within [0, 1]")
    void testRank_ScoresShouldBeBounded() {
        // Given
        RetrievedCandidate overshoot = candidate("c-1", SourceType.GOVERNMENT, 1.7);
        RetrievedCandidate negative = candidate("c-2", SourceType.RETAILER, -0.4);
        RetrievedCandidate bare = RetrievedCandidate.builder()
                .chunkId("c-3")
                .content(null)
                .similarity(Double.NaN)
                .build();

        // When
        List<RankedCandidate> ranked = ranker.rank(List.of(overshoot, negative, bare), context);

        // Then
        for (RankedCandidate candidate : ranked) {
            ScoreBreakdown breakdown = candidate.getScoreBreakdown();
            assertInUnitRange(breakdown.getVector());
            assertInUnitRange(breakdown.getKeyword());
            assertInUnitRange(breakdown.getAuthority());
            assertInUnitRange(breakdown.getMetadata());
            assertInUnitRange(candidate.getRankScore());
        }
    }

    @Test
    @DisplayName("Rank score should increase strictly with vector similarity")
    void testRank_ShouldBeMonotonicInVectorSimilarity() {
        double previous = -1;
        for (double similarity = 0.0; similarity <= 1.0; similarity += 0.1) {
            // When
            RankedCandidate ranked = ranker.rank(List.of(candidate("c", SourceType.OTHER, similarity)), context).get(0);

            // Then
            assertTrue(ranked.getRankScore() > previous, "rank score must grow with similarity " + similarity);
            previous = ranked.getRankScore();
        }
    }

    @Test
    @DisplayName("Metadata score should add crop, region and capped topic matches")
    void testMetadataScore_ShouldCombineMatches() {
        // Given
        CandidateMetadata metadata = CandidateMetadata.builder()
                .crops(List.of("corn", "soybean"))
                .region("Central Iowa")
                .topics(List.of("fertility"))
                .build();

        // When
        double score = HybridRanker.metadataScore(metadata, context);

        // Then
        assertEquals(0.4 + 0.3 + 0.15, score, 1e-9);
        assertEquals(0, HybridRanker.metadataScore(null, context));
    }

    @Test
    @DisplayName("Keyword score should be the fraction of terms found in the content")
    void testKeywordScore_ShouldBeFractionOfTerms() {
        assertEquals(2.0 / 3, HybridRanker.keywordScore("Nitrogen deficiency shows as YELLOWING", List.of("nitrogen", "yellowing", "corn")), 1e-9);
        assertEquals(0, HybridRanker.keywordScore("anything", List.of()));
    }

    private static RetrievedCandidate candidate(String id, SourceType type, double similarity) {
        return RetrievedCandidate.builder()
                .chunkId(id)
                .sourceId("src-" + id)
                .content("Nitrogen deficiency causes yellowing of lower corn leaves.")
                .similarity(similarity)
                .sourceType(type)
                .sourceTitle("Corn fertility guide")
                .metadata(CandidateMetadata.builder().crops(List.of("corn")).build())
                .build();
    }

    private static void assertInUnitRange(double value) {
        assertTrue(value >= 0 && value <= 1, "expected value in [0,1] but was " + value);
    }
}
