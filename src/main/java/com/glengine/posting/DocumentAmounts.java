package com.glengine.posting;

import com.glengine.common.Money;
import com.glengine.ledger.JournalLine;

import java.math.BigDecimal;
import java.util.List;

/**
 * Header arithmetic shared by the invoice and bill adapters.
 */
final class DocumentAmounts {

    private DocumentAmounts() {
    }

    static BigDecimal netTotal(List<? extends PricedLine> lines) {
        return Money.sum(lines.stream().map(line -> Money.orZero(line.getLineAmount())).toList());
    }

    /**
     * Tax posted for the document: the declared tax lines when present, the per-line tax otherwise.
     */
    static BigDecimal documentTax(List<? extends PricedLine> lines, List<TaxLine> taxLines) {
        if (taxLines != null && !taxLines.isEmpty()) {
            return Money.sum(taxLines.stream().map(taxLine -> Money.orZero(taxLine.getTaxAmount())).toList());
        }
        return Money.sum(lines.stream().map(line -> Money.orZero(line.getTaxAmount())).toList());
    }

    /**
     * Document amount with no journal line of its own: per-line tax when no tax lines are declared.
     */
    static BigDecimal unpostedAmount(BigDecimal totalAmount, List<? extends PricedLine> lines, List<TaxLine> taxLines) {
        BigDecimal taxLineTotal = Money.sum(taxLines(taxLines).stream()
            .map(taxLine -> Money.orZero(taxLine.getTaxAmount())).toList());
        return totalAmount.subtract(netTotal(lines)).subtract(taxLineTotal);
    }

    static BigDecimal debitTotal(List<JournalLine> lines) {
        return lines.stream().map(line -> Money.orZero(line.getDebit())).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    static BigDecimal creditTotal(List<JournalLine> lines) {
        return lines.stream().map(line -> Money.orZero(line.getCredit())).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    static List<TaxLine> taxLines(List<TaxLine> taxLines) {
        return taxLines != null ? taxLines : List.of();
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
