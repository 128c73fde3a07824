package com.glengine.posting;

import com.glengine.tax.TaxableLine;

import java.math.BigDecimal;

/**
 * A quantity-times-price document line (invoice or bill).
 */
public interface PricedLine extends TaxableLine {

    int getLineNumber();

    BigDecimal getQuantity();

    BigDecimal getUnitPrice();

    /**
     * Fractional tax rate, or null when the line is untaxed.
     */
    BigDecimal getTaxRate();
}
