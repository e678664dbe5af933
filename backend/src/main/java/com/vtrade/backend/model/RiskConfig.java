package com.vtrade.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Leverage and brokerage override for a segment and product type.
 */
@Entity
@Table(name = "risk_configs", uniqueConstraints = @UniqueConstraint(columnNames = {"segment", "product_type"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 16)
    private String segment;

    @Enumerated(EnumType.STRING)
    @Column(name = "product_type", nullable = false, length = 8)
    private ProductType productType;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal leverage;

    @Column(precision = 19, scale = 4)
    private BigDecimal brokerageFlat;

    @Column(precision = 19, scale = 8)
    private BigDecimal brokerageRate;

    @Column(precision = 19, scale = 4)
    private BigDecimal brokerageCap;

    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    void touch() {
        updatedAt = LocalDateTime.now();
    }
}
