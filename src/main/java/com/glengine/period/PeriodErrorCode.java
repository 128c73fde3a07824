package com.glengine.period;

/**
 * Machine-readable reasons a period operation is refused.
 */
public enum PeriodErrorCode {
    INVALID_INPUT,
    PERIOD_NOT_FOUND,
    PERIOD_ALREADY_CLOSED,
    PERIOD_ALREADY_OPEN,
    SOD_VIOLATION,
    PERIOD_CLOSE_VALIDATION_FAILED,
    APPROVAL_REQUIRED
}
