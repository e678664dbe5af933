package com.vtrade.backend.dto;

import com.vtrade.backend.model.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * {@code cancelled=false} means the order had already reached {@code status} before the cancel landed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CancelOrderResponse {
    private Long orderId;
    private boolean cancelled;
    private OrderStatus status;
    private BigDecimal releasedAmount;
}
