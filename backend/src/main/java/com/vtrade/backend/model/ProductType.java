package com.vtrade.backend.model;

/**
 * MIS is intraday margin, CNC is delivery.
 */
public enum ProductType {
    MIS,
    CNC
}
