package com.vtrade.backend.dto;

import com.vtrade.backend.model.ProductType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskConfigRequest {

    @NotBlank
    private String segment;

    @NotNull
    private ProductType productType;

    @NotNull
    @DecimalMin("1")
    private BigDecimal leverage;

    @DecimalMin("0")
    private BigDecimal brokerageFlat;

    @DecimalMin("0")
    private BigDecimal brokerageRate;

    @DecimalMin("0")
    private BigDecimal brokerageCap;

    @Builder.Default
    private Boolean active = Boolean.TRUE;
}
