package com.glengine.fx;

/**
 * Outcome of an exchange-rate check.
 */
public enum FxRateStatus {
    OK,
    FX_RATE_REQUIRED,
    INVALID_RATE
}
