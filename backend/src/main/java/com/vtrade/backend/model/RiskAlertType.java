package com.vtrade.backend.model;

public enum RiskAlertType {
    LARGE_LOSS,
    MARGIN_CALL
}
