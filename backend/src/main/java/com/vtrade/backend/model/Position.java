package com.vtrade.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Net holding in one instrument and product type. Quantity is signed: positive long, negative short,
 * zero closed. Closed rows are kept as history; a later fill opens a new row.
 */
@Entity
@Table(name = "positions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long tradingAccountId;

    @Column(nullable = false)
    private Long instrumentId;

    @Column(nullable = false)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private ProductType productType;

    @Column(length = 16)
    private String segment;

    @Column(nullable = false)
    private Integer quantity;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal averagePrice;

    /** Margin currently held in the account's usedMargin for the open quantity. */
    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal blockedMargin;

    @Column(precision = 19, scale = 4)
    private BigDecimal stopLoss;

    @Column(precision = 19, scale = 4)
    private BigDecimal target;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal unrealizedPnl;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal dayPnl;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal realizedPnl;

    @Column(precision = 19, scale = 4)
    private BigDecimal lastPrice;

    @Column(nullable = false)
    private LocalDateTime openedAt;

    private LocalDateTime closedAt;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public boolean isOpen() {
        return quantity != null && quantity != 0;
    }

    public boolean isLong() {
        return quantity != null && quantity > 0;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (updatedAt == null) {
            updatedAt = LocalDateTime.now();
        }
        if (openedAt == null) {
            openedAt = createdAt;
        }
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
