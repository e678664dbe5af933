package com.vtrade.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdminPatchPositionResponse {
    private PositionResponse position;
    private AdminOverrideSummary summary;
}
