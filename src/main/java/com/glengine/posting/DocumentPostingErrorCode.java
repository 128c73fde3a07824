package com.glengine.posting;

/**
 * Reasons an invoice or bill cannot be turned into a journal.
 */
public enum DocumentPostingErrorCode {
    INVALID_AMOUNTS,
    INVALID_CURRENCY,
    BUSINESS_RULE_VIOLATION
}
