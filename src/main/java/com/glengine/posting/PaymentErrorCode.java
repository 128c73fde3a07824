package com.glengine.posting;

public enum PaymentErrorCode {
    PAYMENT_VALIDATION_FAILED,
    JOURNAL_VALIDATION_FAILED
}
