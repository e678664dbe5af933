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
public class AdminOverrideSummary {
    private BigDecimal oldValue;
    private BigDecimal newValue;
    private BigDecimal valueDelta;
    private boolean fundsAdjusted;
    private Long fundTransactionId;
    private BigDecimal marginReleased;
    private int ordersUpdated;
    private int transactionsUpdated;
}
