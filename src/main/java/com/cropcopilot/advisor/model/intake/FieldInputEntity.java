package com.cropcopilot.advisor.model.intake;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A grower's submission as stored by intake. Read-only for this service.
 */
@Entity
@Table(name = "field_input", indexes = @Index(name = "idx_field_input_user", columnList = "user_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldInputEntity {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    /**
     * photo, lab_report or hybrid.
     */
    @Column(name = "type", nullable = false, length = 20)
    private String type;

    @Column(name = "image_url", length = 1000)
    private String imageUrl;

    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    @Column(name = "description")
    private String description;

    /**
     * JSON object of analyte to numeric value.
     */
    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    @Column(name = "lab_data")
    private String labData;

    /**
     * JSON array of image observations.
     */
    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    @Column(name = "image_observations")
    private String imageObservations;

    @Column(name = "location", length = 255)
    private String location;

    @Column(name = "crop", length = 100)
    private String crop;

    @Column(name = "season", length = 100)
    private String season;

    @Column(name = "field_acreage")
    private Double fieldAcreage;

    @Column(name = "planned_application_date")
    private LocalDate plannedApplicationDate;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
