package com.cropcopilot.advisor.knowledge;

import com.cropcopilot.advisor.model.corpus.TaggedChunk;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Compliance Chunker Tests")
class ComplianceChunkerTest {

    private final ComplianceChunker chunker = new ComplianceChunker(new SemanticChunker());

    @Test
    @DisplayName("Should detect regulatory topics in label text")
    void testDetectTags_ShouldFindRegulatoryTopics() {
        // Given
        String text = "Restricted-entry interval (REI): 12 hours. Pre-harvest interval 7 days. "
                + "Maximum seasonal rate 2 qt/A. Do not apply before bloom in any county where prohibited.";

        // When
        List<String> tags = ComplianceChunker.detectTags(text);

        // Then
        assertThat(tags).containsExactly("rei", "phi", "dose_limit", "crop_stage", "jurisdiction", "restriction");
    }

    @Test
    @DisplayName("Should fall back to the general tag")
    void testDetectTags_ShouldFallBackToGeneral() {
        assertEquals(List.of(ComplianceChunker.GENERAL_TAG), ComplianceChunker.detectTags("Scout weekly for aphids."));
        assertEquals(List.of(ComplianceChunker.GENERAL_TAG), ComplianceChunker.detectTags(null));
    }

    @Test
    @DisplayName("Should number chunks from the start position")
    void testChunk_ShouldAssignRunningPositions() {
        // Given
        String paragraph = "Observe the pre-harvest interval listed on the product label for each crop. ".repeat(6).trim();
        String text = String.join("\n\n", paragraph, paragraph, paragraph, paragraph, paragraph, paragraph);

        // When
        List<TaggedChunk> chunks = chunker.chunk("Directions for use", text, 7);

        // Then
        assertTrue(chunks.size() >= 2);
        for (int i = 0; i < chunks.size(); i++) {
            assertEquals(7 + i, chunks.get(i).getPosition());
            assertThat(chunks.get(i).getTags()).contains("phi", "jurisdiction");
        }
    }
}
