package com.vtrade.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Raised by the account risk monitor when unrealized loss crosses the warning or auto-close share of an
 * account's funds.
 */
@Entity
@Table(name = "risk_alerts")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskAlert {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long tradingAccountId;

    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RiskAlertType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RiskAlertSeverity severity;

    @Column(nullable = false, length = 512)
    private String message;

    @Column(precision = 19, scale = 4)
    private BigDecimal unrealizedLoss;

    @Column(precision = 9, scale = 4)
    private BigDecimal utilization;

    private int positionsClosed;

    private boolean resolved;

    private LocalDateTime resolvedAt;

    @Column(nullable = false)
    private LocalDateTime createdAt;
}
