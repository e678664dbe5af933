package com.vtrade.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "orders")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeOrder {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long tradingAccountId;

    @Column(nullable = false)
    private Long instrumentId;

    @Column(nullable = false)
    private String symbol;

    @Column(nullable = false)
    private Integer quantity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private OrderType orderType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private OrderSide orderSide;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private ProductType productType;

    /** Limit price; null for MARKET orders. */
    @Column(precision = 19, scale = 4)
    private BigDecimal price;

    /** Price the reservation was quoted at. */
    @Column(precision = 19, scale = 4)
    private BigDecimal quotedPrice;

    @Column(nullable = false)
    private Integer filledQuantity;

    @Column(precision = 19, scale = 4)
    private BigDecimal averagePrice;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private OrderStatus status;

    /** Amount held in usedMargin for this order while PENDING; null on rows created outside placement. */
    @Column(precision = 19, scale = 4)
    private BigDecimal marginBlocked;

    @Column(precision = 19, scale = 4)
    private BigDecimal chargesBlocked;

    @Column(nullable = false)
    private boolean exitOrder;

    private Long positionId;

    @Column(length = 255)
    private String rejectionReason;

    @Column(nullable = false)
    private LocalDateTime executeAfter;

    private LocalDateTime executedAt;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public BigDecimal reservedTotal() {
        if (marginBlocked == null && chargesBlocked == null) {
            return null;
        }
        BigDecimal margin = marginBlocked == null ? BigDecimal.ZERO : marginBlocked;
        BigDecimal charges = chargesBlocked == null ? BigDecimal.ZERO : chargesBlocked;
        return margin.add(charges);
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (updatedAt == null) {
            updatedAt = LocalDateTime.now();
        }
        if (executeAfter == null) {
            executeAfter = createdAt;
        }
        if (filledQuantity == null) {
            filledQuantity = 0;
        }
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
