package com.vtrade.backend.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FundsRequest {

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal amount;

    @Size(max = 255)
    private String note;
}
