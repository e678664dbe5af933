package com.vtrade.backend.dto;

import com.vtrade.backend.model.OrderSide;
import com.vtrade.backend.model.OrderType;
import com.vtrade.backend.model.ProductType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaceOrderRequest {

    @NotBlank
    private String symbol;

    @NotNull
    @Positive
    private Integer quantity;

    @NotNull
    private OrderType orderType;

    @NotNull
    private OrderSide orderSide;

    @NotNull
    private ProductType productType;

    /** Required for LIMIT orders, ignored for MARKET. */
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal price;
}
