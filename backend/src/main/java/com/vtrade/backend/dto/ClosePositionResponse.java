package com.vtrade.backend.dto;

import com.vtrade.backend.model.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClosePositionResponse {
    private Long positionId;
    private Long exitOrderId;
    private OrderStatus exitOrderStatus;
    private int closedQuantity;
    private BigDecimal exitPrice;
    private BigDecimal realizedPnl;
    private BigDecimal charges;
    private int remainingQuantity;
    private String message;
}
