package com.cropcopilot.advisor.model.corpus;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A catalog product attached to a recommendation, in plan order.
 */
@Entity
@Table(name = "product_recommendation",
        indexes = @Index(name = "idx_product_rec_recommendation", columnList = "recommendation_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductRecommendationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "recommendation_id", nullable = false, length = 64)
    private String recommendationId;

    @Column(name = "product_id", nullable = false, length = 64)
    private String productId;

    @Column(name = "application_rate", length = 255)
    private String applicationRate;

    @Column(name = "reason", length = 2000)
    private String reason;

    @Column(name = "priority", nullable = false)
    private int priority;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
