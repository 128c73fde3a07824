package com.glengine.tax;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of checking a supplied tax amount against the expected one.
 */
@Value
public class TaxCheck {
    boolean valid;
    BigDecimal expectedTaxAmount;
    BigDecimal difference;

    public static TaxCheck ok(BigDecimal expected) {
        return new TaxCheck(true, expected, BigDecimal.ZERO);
    }

    public static TaxCheck mismatch(BigDecimal expected, BigDecimal difference) {
        return new TaxCheck(false, expected, difference);
    }
}
