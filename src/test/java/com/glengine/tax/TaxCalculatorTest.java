package com.glengine.tax;

import lombok.Value;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaxCalculatorTest {

    private final TaxCalculator calculator = new TaxCalculator();

    @Test
    void testComputeLineTax() {
        assertEquals(new BigDecimal("60.00"), calculator.computeLineTax(new BigDecimal("1000.00"), new BigDecimal("0.06")));
        assertEquals(new BigDecimal("0.00"), calculator.computeLineTax(new BigDecimal("1000.00"), null));
    }

    @Test
    void testLineTaxWithinOneCent() {
        TaxCheck check = calculator.validateLineTax(new BigDecimal("33.33"), new BigDecimal("0.06"), new BigDecimal("2.00"));

        assertTrue(check.isValid());
        assertEquals(new BigDecimal("2.00"), check.getExpectedTaxAmount());
    }

    @Test
    void testLineTaxMismatch() {
        TaxCheck check = calculator.validateLineTax(new BigDecimal("1000.00"), new BigDecimal("0.06"), new BigDecimal("50.00"));

        assertFalse(check.isValid());
        assertEquals(new BigDecimal("60.00"), check.getExpectedTaxAmount());
        assertEquals(0, new BigDecimal("10.00").compareTo(check.getDifference()));
    }

    @Test
    void testTotals() {
        DocumentTotals totals = calculator.totals(List.of(
            new Line(new BigDecimal("1000.00"), new BigDecimal("60.00")),
            new Line(new BigDecimal("500.00"), new BigDecimal("30.00")),
            new Line(new BigDecimal("0.004"), null)
        ));

        assertEquals(new BigDecimal("1500.00"), totals.getSubtotal());
        assertEquals(new BigDecimal("90.00"), totals.getTaxAmount());
        assertEquals(new BigDecimal("1590.00"), totals.getTotalAmount());
    }

    @Value
    private static class Line implements TaxableLine {
        BigDecimal lineAmount;
        BigDecimal taxAmount;
    }
}
