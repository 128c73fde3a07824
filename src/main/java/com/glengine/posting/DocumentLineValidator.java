package com.glengine.posting;

import com.glengine.common.Money;
import com.glengine.tax.TaxCalculator;
import com.glengine.tax.TaxCheck;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Arithmetic checks shared by invoice and bill lines. Reports every problem
 * found rather than stopping at the first.
 */
@Component
@RequiredArgsConstructor
public class DocumentLineValidator {

    private final TaxCalculator taxCalculator;

    public LineValidation validateLines(List<? extends PricedLine> lines) {
        List<String> errors = new ArrayList<>();

        for (PricedLine line : lines) {
            BigDecimal quantity = Money.orZero(line.getQuantity());
            BigDecimal unitPrice = Money.orZero(line.getUnitPrice());
            BigDecimal lineAmount = Money.orZero(line.getLineAmount());

            BigDecimal expected = quantity.multiply(unitPrice);
            if (!Money.withinTolerance(lineAmount, expected)) {
                errors.add(String.format("Line %d: Line amount %s does not match quantity * unit price %s",
                    line.getLineNumber(), lineAmount, Money.round(expected)));
            }

            if (Money.isPositive(line.getTaxRate())) {
                TaxCheck taxCheck = taxCalculator.validateLineTax(lineAmount, line.getTaxRate(), line.getTaxAmount());
                if (!taxCheck.isValid()) {
                    errors.add(String.format("Line %d: Tax amount %s does not match line amount * tax rate %s",
                        line.getLineNumber(), Money.orZero(line.getTaxAmount()), taxCheck.getExpectedTaxAmount()));
                }
            }

            if (quantity.signum() <= 0) {
                errors.add(String.format("Line %d: Quantity must be positive", line.getLineNumber()));
            }
            if (unitPrice.signum() < 0) {
                errors.add(String.format("Line %d: Unit price cannot be negative", line.getLineNumber()));
            }
            if (lineAmount.signum() < 0) {
                errors.add(String.format("Line %d: Line amount cannot be negative", line.getLineNumber()));
            }
        }

        return new LineValidation(errors.isEmpty(), errors);
    }
}
