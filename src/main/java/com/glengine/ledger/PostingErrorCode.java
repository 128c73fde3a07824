package com.glengine.ledger;

/**
 * Machine-readable reasons a journal is rejected.
 */
public enum PostingErrorCode {
    INVALID_ACCOUNTS,
    INVALID_AMOUNT,
    JOURNAL_UNBALANCED,
    INVALID_CURRENCY,
    SOD_VIOLATION,
    BUSINESS_RULE_VIOLATION
}
