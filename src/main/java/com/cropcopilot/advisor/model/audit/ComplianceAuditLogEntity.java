package com.cropcopilot.advisor.model.audit;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * One compliance check outcome. The rows of a recommendation are replaced
 * as a set on every evaluation.
 */
@Entity
@Table(name = "compliance_audit_log",
        indexes = @Index(name = "idx_compliance_audit_recommendation", columnList = "recommendation_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComplianceAuditLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "recommendation_id", nullable = false, length = 64)
    private String recommendationId;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "check_id", nullable = false, length = 64)
    private String checkId;

    @Column(name = "rule_version", nullable = false, length = 64)
    private String ruleVersion;

    @Column(name = "source_version", length = 100)
    private String sourceVersion;

    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    @Column(name = "input_snapshot")
    private String inputSnapshot;

    @Column(name = "result", nullable = false, length = 40)
    private String result;

    @Column(name = "message", length = 2000)
    private String message;

    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    @Column(name = "evidence")
    private String evidence;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
