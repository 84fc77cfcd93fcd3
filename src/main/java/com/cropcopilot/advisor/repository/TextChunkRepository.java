package com.cropcopilot.advisor.repository;

import com.cropcopilot.advisor.model.corpus.TextChunkEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Reference passages. The similarity and lexical searches are PostgreSQL
 * native queries (pgvector {@code <=>} cosine distance, POSIX regex match).
 */
@Repository
public interface TextChunkRepository extends JpaRepository<TextChunkEntity, String> {

    /**
     * Nearest passages by cosine similarity, with a small crop substring boost
     * and the per-source editorial boost folded into {@code hybridScore}.
     */
    @Query(value = """
            SELECT
              t.id AS "chunkId",
              t.content AS "content",
              t.metadata AS "metadata",
              s.id AS "sourceId",
              s.title AS "sourceTitle",
              s.source_type AS "sourceType",
              s.institution AS "institution",
              CAST(COALESCE(sb.boost, 0) AS double precision) AS "sourceBoost",
              CAST(1 - (t.embedding <=> CAST(:vector AS vector)) AS double precision) AS "similarity",
              CAST(
                (1 - (t.embedding <=> CAST(:vector AS vector)))
                + CASE WHEN :crop <> '' AND lower(t.content) LIKE '%' || lower(:crop) || '%' THEN 0.08 ELSE 0 END
                + CASE WHEN :crop <> '' AND lower(s.title) LIKE '%' || lower(:crop) || '%' THEN 0.05 ELSE 0 END
                + CASE WHEN :crop <> '' AND lower(coalesce(t.metadata, '')) LIKE '%' || lower(:crop) || '%' THEN 0.04 ELSE 0 END
                + COALESCE(sb.boost, 0)
              AS double precision) AS "hybridScore"
            FROM text_chunk t
            JOIN reference_source s ON s.id = t.source_id
            LEFT JOIN source_boost sb ON sb.source_id = s.id
            WHERE t.embedding IS NOT NULL
              AND s.status IN ('ready', 'processed')
            ORDER BY "hybridScore" DESC
            LIMIT :limit
            """, nativeQuery = true)
    List<CandidateRow> searchByVector(@Param("vector") String vector,
                                      @Param("crop") String crop,
                                      @Param("limit") int limit);

    /**
     * Passages whose content, source title or metadata match the regex
     * alternation {@code pattern}, newest first.
     */
    @Query(value = """
            SELECT
              t.id AS "chunkId",
              t.content AS "content",
              t.metadata AS "metadata",
              s.id AS "sourceId",
              s.title AS "sourceTitle",
              s.source_type AS "sourceType",
              s.institution AS "institution",
              CAST(COALESCE(sb.boost, 0) AS double precision) AS "sourceBoost",
              CAST(0 AS double precision) AS "similarity",
              CAST(NULL AS double precision) AS "hybridScore"
            FROM text_chunk t
            JOIN reference_source s ON s.id = t.source_id
            LEFT JOIN source_boost sb ON sb.source_id = s.id
            WHERE s.status IN ('ready', 'processed')
              AND (
                lower(t.content) ~ :pattern
                OR lower(s.title) ~ :pattern
                OR lower(coalesce(t.metadata, '')) ~ :pattern
              )
            ORDER BY t.created_at DESC
            LIMIT :limit
            """, nativeQuery = true)
    List<CandidateRow> searchByPattern(@Param("pattern") String pattern,
                                       @Param("limit") int limit);

    @Modifying
    @Query(value = "UPDATE text_chunk SET embedding = CAST(:vector AS vector) WHERE id = :id",
            nativeQuery = true)
    int updateEmbedding(@Param("id") String id, @Param("vector") String vector);
}
