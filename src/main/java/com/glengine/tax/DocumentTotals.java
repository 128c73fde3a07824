package com.glengine.tax;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Net, tax and gross totals of a document, each rounded to two decimals.
 */
@Value
public class DocumentTotals {
    BigDecimal subtotal;
    BigDecimal taxAmount;
    BigDecimal totalAmount;
}
