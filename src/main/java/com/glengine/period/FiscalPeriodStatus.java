package com.glengine.period;

/**
 * Fiscal period lifecycle states.
 *
 * OPEN -> CLOSED on close, CLOSED -> LOCKED on a full lock,
 * CLOSED or LOCKED -> OPEN on reopen.
 */
public enum FiscalPeriodStatus {
    OPEN,
    CLOSED,
    LOCKED;

    public boolean isClosed() {
        return this != OPEN;
    }
}
