package com.cropcopilot.advisor.model.corpus;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * One retrievable passage of a reference source.
 *
 * The pgvector {@code embedding} column is intentionally not mapped; it is
 * written with {@code TextChunkRepository#updateEmbedding} and read only by
 * the native similarity query.
 */
@Entity
@Table(name = "text_chunk", indexes = @Index(name = "idx_text_chunk_source", columnList = "source_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TextChunkEntity {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "source_id", nullable = false, length = 64)
    private String sourceId;

    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    @Column(name = "content", nullable = false)
    private String content;

    /**
     * JSON object: crops, topics, tags, region, position, updatedAt.
     */
    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    @Column(name = "metadata")
    private String metadata;

    @Column(name = "position")
    private Integer position;

    @Column(name = "token_count")
    private Integer tokenCount;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
