package com.cropcopilot.advisor.model.audit;

import com.cropcopilot.advisor.model.compliance.InsightStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Persisted risk decision for a recommendation; one row per recommendation,
 * overwritten on re-evaluation.
 */
@Entity
@Table(name = "premium_insight")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PremiumInsightEntity {

    @Id
    @Column(name = "recommendation_id", length = 64)
    private String recommendationId;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private InsightStatus status;

    /**
     * clear_signal, needs_manual_verification or potential_conflict; null until ready.
     */
    @Column(name = "risk_review", length = 40)
    private String riskReview;

    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    @Column(name = "checks")
    private String checks;

    @Column(name = "advisory_notice", length = 500)
    private String advisoryNotice;

    @Column(name = "failure_reason", length = 2000)
    private String failureReason;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}
