package com.glengine.period;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Pre-close report. Errors block a close unless it is forced; warnings never do.
 */
@Value
public class PeriodCloseValidation {
    boolean canClose;
    List<String> warnings;
    List<String> errors;
    PeriodCloseChecks checks;

    /**
     * Signed trial balance difference (debits minus credits) through period end.
     */
    BigDecimal trialBalanceDifference;
}
