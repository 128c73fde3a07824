package com.glengine.tax;

import com.glengine.common.Money;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;

/**
 * Line and document tax arithmetic.
 *
 * Rates are fractions (0.06 for 6%). Document totals are summed unrounded and
 * rounded once at the end.
 */
@Component
public class TaxCalculator {

    public BigDecimal computeLineTax(BigDecimal lineAmount, BigDecimal taxRate) {
        return Money.round(Money.orZero(lineAmount).multiply(Money.orZero(taxRate)));
    }

    /**
     * Compare a supplied tax amount with {@code lineAmount * taxRate}, allowing one cent of drift.
     */
    public TaxCheck validateLineTax(BigDecimal lineAmount, BigDecimal taxRate, BigDecimal suppliedTaxAmount) {
        BigDecimal exact = Money.orZero(lineAmount).multiply(Money.orZero(taxRate));
        BigDecimal difference = exact.subtract(Money.orZero(suppliedTaxAmount));
        if (difference.abs().compareTo(Money.TOLERANCE) > 0) {
            return TaxCheck.mismatch(Money.round(exact), Money.round(difference));
        }
        return TaxCheck.ok(Money.round(exact));
    }

    public DocumentTotals totals(Collection<? extends TaxableLine> lines) {
        BigDecimal subtotal = Money.sum(lines.stream()
            .map(line -> Money.orZero(line.getLineAmount()))
            .toList());
        BigDecimal taxAmount = Money.sum(lines.stream()
            .map(line -> Money.orZero(line.getTaxAmount()))
            .toList());
        return new DocumentTotals(subtotal, taxAmount, subtotal.add(taxAmount));
    }
}
