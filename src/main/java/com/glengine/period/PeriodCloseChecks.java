package com.glengine.period;

import lombok.Value;

/**
 * Individual pre-close checks.
 */
@Value
public class PeriodCloseChecks {
    boolean allJournalsPosted;
    boolean trialBalanceBalanced;
    boolean noUnreconciledTransactions;
    boolean allRequiredAdjustments;
    boolean approvalRequired;
    boolean sodCompliance;
}
