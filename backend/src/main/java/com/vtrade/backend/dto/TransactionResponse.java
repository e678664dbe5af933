package com.vtrade.backend.dto;

import com.vtrade.backend.model.LedgerTransaction;
import com.vtrade.backend.model.TransactionCategory;
import com.vtrade.backend.model.TransactionType;
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
public class TransactionResponse {

    private Long id;
    private TransactionType type;
    private TransactionCategory category;
    private BigDecimal amount;
    private String description;
    private Long orderId;
    private Long positionId;
    private LocalDateTime createdAt;

    public static TransactionResponse from(LedgerTransaction transaction) {
        return TransactionResponse.builder()
                .id(transaction.getId())
                .type(transaction.getType())
                .category(transaction.getCategory())
                .amount(transaction.getAmount())
                .description(transaction.getDescription())
                .orderId(transaction.getOrderId())
                .positionId(transaction.getPositionId())
                .createdAt(transaction.getCreatedAt())
                .build();
    }
}
