package com.glengine.fx;

import com.glengine.common.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Decides when a transaction needs an exchange rate and converts amounts into
 * the base currency.
 *
 * Rates are always supplied by the caller (document header or journal input);
 * this component never looks them up. All GL postings land in base currency.
 */
@Component
@Slf4j
public class FxPolicyResolver {

    public boolean requiresFxRate(String baseCurrency, String txCurrency) {
        return !baseCurrency.equals(txCurrency);
    }

    /**
     * Validate a caller-supplied rate.
     *
     * @param suppliedRate may be null when no conversion is needed
     * @return OK with the rate to apply (1 when the currencies match)
     */
    public FxRateCheck validateRate(String baseCurrency, String txCurrency, BigDecimal suppliedRate) {
        if (requiresFxRate(baseCurrency, txCurrency)) {
            if (!Money.isPositive(suppliedRate)) {
                log.debug("FX rate missing or non-positive for {} -> {}: {}", txCurrency, baseCurrency, suppliedRate);
                return FxRateCheck.rateRequired(baseCurrency, txCurrency);
            }
            return FxRateCheck.ok(suppliedRate);
        }

        if (suppliedRate != null && suppliedRate.signum() <= 0) {
            return FxRateCheck.invalidRate(suppliedRate);
        }
        return FxRateCheck.ok(BigDecimal.ONE);
    }

    /**
     * Convert a transaction-currency amount to base currency, rounded HALF_UP to 2 places.
     * Callers summing many converted lines must not compare these per-line results
     * against a total converted once; see {@link #convert}.
     */
    public BigDecimal toBase(BigDecimal amount, BigDecimal rate) {
        return Money.round(convert(amount, rate));
    }

    /**
     * Convert without rounding. Balance checks run on these amounts.
     */
    public BigDecimal convert(BigDecimal amount, BigDecimal rate) {
        return Money.orZero(amount).multiply(rate);
    }
}
