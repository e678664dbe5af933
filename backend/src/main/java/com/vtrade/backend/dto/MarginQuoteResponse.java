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
public class MarginQuoteResponse {
    private String symbol;
    private String segment;
    private BigDecimal price;
    private int lotSize;
    private BigDecimal orderValue;
    private BigDecimal leverage;
    private BigDecimal marginRequired;
    private BigDecimal brokerage;
    private BigDecimal stt;
    private BigDecimal exchangeFee;
    private BigDecimal gst;
    private BigDecimal stampDuty;
    private BigDecimal otherCharges;
    private BigDecimal totalCost;
    private BigDecimal availableMargin;
    private BigDecimal shortfall;
    private boolean sufficient;
}
