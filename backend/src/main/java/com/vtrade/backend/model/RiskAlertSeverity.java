package com.vtrade.backend.model;

public enum RiskAlertSeverity {
    HIGH,
    CRITICAL
}
