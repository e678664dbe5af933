package com.vtrade.backend.model;

public enum TransactionType {
    CREDIT,
    DEBIT
}
