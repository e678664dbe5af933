package com.vtrade.backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Admin correction of a position. Quantity is the absolute size; the position keeps its direction.
 * For stop-loss and target an explicit JSON null clears the level, while an absent field leaves it alone.
 */
@Data
@NoArgsConstructor
public class AdminPatchPositionRequest {

    @PositiveOrZero
    private Integer quantity;

    @DecimalMin("0")
    private BigDecimal averagePrice;

    private String symbol;

    @DecimalMin("0")
    private BigDecimal stopLoss;

    @DecimalMin("0")
    private BigDecimal target;

    private BigDecimal unrealizedPnl;

    private BigDecimal dayPnl;

    private Action action;

    private boolean cascadeToOrders;

    private boolean cascadeToTransactions;

    private boolean manageFunds;

    @JsonIgnore
    private boolean stopLossPresent;

    @JsonIgnore
    private boolean targetPresent;

    public void setStopLoss(BigDecimal stopLoss) {
        this.stopLoss = stopLoss;
        this.stopLossPresent = true;
    }

    public void setTarget(BigDecimal target) {
        this.target = target;
        this.targetPresent = true;
    }

    public boolean hasChanges() {
        return quantity != null || averagePrice != null || symbol != null || stopLossPresent || targetPresent
                || unrealizedPnl != null || dayPnl != null || action != null;
    }

    public enum Action {
        CLOSE
    }
}
