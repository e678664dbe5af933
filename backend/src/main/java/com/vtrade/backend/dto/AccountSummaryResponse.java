package com.vtrade.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountSummaryResponse {
    private Long accountId;
    private Long userId;
    private BigDecimal balance;
    private BigDecimal availableMargin;
    private BigDecimal usedMargin;
    private int openPositions;
    private long pendingOrders;
    private BigDecimal unrealizedPnl;
    private BigDecimal dayPnl;
}
