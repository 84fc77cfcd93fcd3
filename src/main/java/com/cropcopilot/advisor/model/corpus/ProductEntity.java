package com.cropcopilot.advisor.model.corpus;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "product")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductEntity {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "product_type", length = 50)
    private String productType;

    @Column(name = "registrant", length = 255)
    private String registrant;

    /**
     * Label rate, used when a suggestion names the product without a rate.
     */
    @Column(name = "application_rate", length = 255)
    private String applicationRate;

    /**
     * Comma-separated crop names; empty means the label is not crop-specific.
     */
    @Column(name = "crops", length = 1000)
    private String crops;
}
