package com.vtrade.backend.dto;

import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClosePositionRequest {

    /** Units to close; absent closes the whole position. */
    @Positive
    private Integer quantity;
}
