package com.vtrade.backend.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdminPlaceOrderRequest {

    @NotNull
    private Long userId;

    @NotNull
    @Valid
    private PlaceOrderRequest order;
}
