package com.glengine.fx;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of validating a supplied exchange rate.
 */
@Value
public class FxRateCheck {
    FxRateStatus status;
    BigDecimal effectiveRate;
    String message;

    public static FxRateCheck ok(BigDecimal effectiveRate) {
        return new FxRateCheck(FxRateStatus.OK, effectiveRate, null);
    }

    public static FxRateCheck rateRequired(String baseCurrency, String txCurrency) {
        return new FxRateCheck(FxRateStatus.FX_RATE_REQUIRED, null,
            String.format("Exchange rate required for %s to %s conversion", txCurrency, baseCurrency));
    }

    public static FxRateCheck invalidRate(BigDecimal rate) {
        return new FxRateCheck(FxRateStatus.INVALID_RATE, null,
            "Exchange rate must be positive, got " + rate);
    }

    public boolean isOk() {
        return status == FxRateStatus.OK;
    }
}
