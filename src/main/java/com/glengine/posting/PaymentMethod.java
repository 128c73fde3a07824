package com.glengine.posting;

public enum PaymentMethod {
    BANK_TRANSFER,
    CHECK,
    CASH,
    CREDIT_CARD,
    DEBIT_CARD,
    OTHER
}
