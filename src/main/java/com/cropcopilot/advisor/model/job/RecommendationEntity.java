package com.cropcopilot.advisor.model.job;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Stored recommendation result. Written once per job.
 */
@Entity
@Table(name = "recommendation",
        uniqueConstraints = @UniqueConstraint(name = "uk_recommendation_job", columnNames = "job_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationEntity {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "job_id", nullable = false, length = 64)
    private String jobId;

    @Column(name = "input_id", nullable = false, length = 64)
    private String inputId;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "confidence", nullable = false)
    private double confidence;

    @Column(name = "model_used", nullable = false, length = 100)
    private String modelUsed;

    @Column(name = "condition_type", length = 30)
    private String conditionType;

    /**
     * Full result serialized as JSON.
     */
    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    @Column(name = "payload", nullable = false)
    private String payload;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
