package com.vtrade.backend.dto;

import com.vtrade.backend.model.Position;
import com.vtrade.backend.model.ProductType;
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
public class PositionResponse {

    private Long id;
    private String symbol;
    private ProductType productType;
    private String segment;
    private Integer quantity;
    private BigDecimal averagePrice;
    private BigDecimal lastPrice;
    private BigDecimal blockedMargin;
    private BigDecimal stopLoss;
    private BigDecimal target;
    private BigDecimal unrealizedPnl;
    private BigDecimal dayPnl;
    private BigDecimal realizedPnl;
    private boolean open;
    private LocalDateTime openedAt;
    private LocalDateTime closedAt;

    public static PositionResponse from(Position position) {
        return PositionResponse.builder()
                .id(position.getId())
                .symbol(position.getSymbol())
                .productType(position.getProductType())
                .segment(position.getSegment())
                .quantity(position.getQuantity())
                .averagePrice(position.getAveragePrice())
                .lastPrice(position.getLastPrice())
                .blockedMargin(position.getBlockedMargin())
                .stopLoss(position.getStopLoss())
                .target(position.getTarget())
                .unrealizedPnl(position.getUnrealizedPnl())
                .dayPnl(position.getDayPnl())
                .realizedPnl(position.getRealizedPnl())
                .open(position.isOpen())
                .openedAt(position.getOpenedAt())
                .closedAt(position.getClosedAt())
                .build();
    }
}
