package com.vtrade.backend.model;

public enum OrderType {
    MARKET,
    LIMIT
}
