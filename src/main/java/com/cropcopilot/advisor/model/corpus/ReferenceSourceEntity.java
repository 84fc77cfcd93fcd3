package com.cropcopilot.advisor.model.corpus;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A reference document (extension bulletin, label, paper) whose chunks
 * make up the retrieval corpus. Only sources in status {@code ready} or
 * {@code processed} are searchable.
 */
@Entity
@Table(name = "reference_source")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReferenceSourceEntity {

    public static final String STATUS_READY = "ready";
    public static final String STATUS_PROCESSED = "processed";
    public static final String STATUS_PENDING = "pending";

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "title", nullable = false, length = 500)
    private String title;

    @Column(name = "source_type", nullable = false, length = 50)
    private String sourceType;

    @Column(name = "institution", length = 255)
    private String institution;

    @Column(name = "url", length = 1000)
    private String url;

    @Column(name = "status", nullable = false, length = 30)
    private String status;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (status == null) {
            status = STATUS_PENDING;
        }
    }
}
