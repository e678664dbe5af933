package com.vtrade.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionRelatedResponse {
    private PositionResponse position;
    private List<OrderResponse> orders;
    private List<TransactionResponse> transactions;
}
