package com.vtrade.backend.dto;

import jakarta.validation.constraints.DecimalMin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Stop-loss and target for an open position; a null field clears the level.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateProtectionRequest {

    @DecimalMin("0")
    private BigDecimal stopLoss;

    @DecimalMin("0")
    private BigDecimal target;
}
