package com.cropcopilot.advisor.model.corpus;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Editorial score adjustment for a source, added to its retrieval score.
 */
@Entity
@Table(name = "source_boost")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SourceBoostEntity {

    @Id
    @Column(name = "source_id", length = 64)
    private String sourceId;

    @Column(name = "boost", nullable = false)
    private double boost;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
