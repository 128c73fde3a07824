package com.glengine.ledger;

import java.math.BigDecimal;

/**
 * Posted debit and credit totals as of a date.
 */
public interface TrialBalanceTotals {

    BigDecimal getTotalDebits();

    BigDecimal getTotalCredits();
}
