package com.glengine.tax;

import java.math.BigDecimal;

/**
 * A document line that carries a net amount and the tax charged on it.
 */
public interface TaxableLine {

    BigDecimal getLineAmount();

    /**
     * Tax charged on this line; null is treated as zero.
     */
    BigDecimal getTaxAmount();
}
