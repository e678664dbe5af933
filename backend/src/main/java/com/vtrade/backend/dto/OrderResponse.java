package com.vtrade.backend.dto;

import com.vtrade.backend.model.OrderSide;
import com.vtrade.backend.model.OrderStatus;
import com.vtrade.backend.model.OrderType;
import com.vtrade.backend.model.ProductType;
import com.vtrade.backend.model.TradeOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderResponse {

    private Long id;
    private String symbol;
    private Integer quantity;
    private OrderType orderType;
    private OrderSide orderSide;
    private ProductType productType;
    private BigDecimal price;
    private OrderStatus status;
    private Integer filledQuantity;
    private BigDecimal averagePrice;
    private BigDecimal marginBlocked;
    private BigDecimal chargesBlocked;
    private boolean exitOrder;
    private Long positionId;
    private String rejectionReason;
    private LocalDateTime createdAt;
    private LocalDateTime executedAt;

    public static OrderResponse from(TradeOrder order) {
        return OrderResponse.builder()
                .id(order.getId())
                .symbol(order.getSymbol())
                .quantity(order.getQuantity())
                .orderType(order.getOrderType())
                .orderSide(order.getOrderSide())
                .productType(order.getProductType())
                .price(order.getPrice())
                .status(order.getStatus())
                .filledQuantity(order.getFilledQuantity())
                .averagePrice(order.getAveragePrice())
                .marginBlocked(order.getMarginBlocked())
                .chargesBlocked(order.getChargesBlocked())
                .exitOrder(order.isExitOrder())
                .positionId(order.getPositionId())
                .rejectionReason(order.getRejectionReason())
                .createdAt(order.getCreatedAt())
                .executedAt(order.getExecutedAt())
                .build();
    }
}
