package com.cropcopilot.advisor.model.audit;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Append-only record of what retrieval considered, used and missed for one
 * recommendation. Hibernate ignores updates to {@link Immutable} entities.
 */
@Entity
@Immutable
@Table(name = "retrieval_audit",
        uniqueConstraints = @UniqueConstraint(name = "uk_retrieval_audit_recommendation",
                columnNames = "recommendation_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrievalAuditEntity {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "input_id", nullable = false, length = 64)
    private String inputId;

    @Column(name = "recommendation_id", nullable = false, length = 64)
    private String recommendationId;

    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    @Column(name = "query", nullable = false)
    private String query;

    /**
     * JSON array of up to 12 expanded query terms.
     */
    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    @Column(name = "topics", nullable = false)
    private String topics;

    // ================================================================
    // CHUNK SETS (JSON arrays of AuditedChunk)
    // ================================================================

    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    @Column(name = "candidate_chunks", nullable = false)
    private String candidateChunks;

    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    @Column(name = "used_chunks", nullable = false)
    private String usedChunks;

    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    @Column(name = "missed_chunks", nullable = false)
    private String missedChunks;

    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    @Column(name = "image_links")
    private String imageLinks;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
