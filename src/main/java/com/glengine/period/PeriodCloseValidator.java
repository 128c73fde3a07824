package com.glengine.period;

import com.glengine.common.Money;
import com.glengine.ledger.JournalRepository;
import com.glengine.ledger.TrialBalanceTotals;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Pre-close checks for a fiscal period:
 * 1. No unposted journals dated in the period (error)
 * 2. Trial balance through period end nets to zero (error)
 * 3. No unreconciled bank transactions (warning)
 * 4. Required adjustments present (not tracked; always passes)
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PeriodCloseValidator {

    private final JournalRepository journalRepository;
    private final BankReconciliationSource bankReconciliationSource;

    @Transactional(readOnly = true)
    public PeriodCloseValidation validate(FiscalPeriod period) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        long unposted = journalRepository.countUnposted(
            period.getTenantId(), period.getCompanyId(), period.getStartDate(), period.getEndDate());
        boolean allJournalsPosted = unposted == 0;
        if (!allJournalsPosted) {
            errors.add(unposted + " unposted journal entries found");
        }

        TrialBalanceTotals totals = journalRepository.trialBalance(
            period.getTenantId(), period.getCompanyId(), period.getEndDate());
        BigDecimal debits = totals == null ? BigDecimal.ZERO : Money.orZero(totals.getTotalDebits());
        BigDecimal credits = totals == null ? BigDecimal.ZERO : Money.orZero(totals.getTotalCredits());
        BigDecimal difference = Money.round(debits.subtract(credits));
        boolean trialBalanceBalanced = Money.withinTolerance(debits, credits);
        if (!trialBalanceBalanced) {
            errors.add("Trial balance is out of balance by " + difference);
        }

        long unreconciled = bankReconciliationSource.countUnreconciled(
            period.getTenantId(), period.getCompanyId(), period.getEndDate());
        if (unreconciled > 0) {
            warnings.add(unreconciled + " unreconciled bank transactions");
        }

        PeriodCloseChecks checks = new PeriodCloseChecks(
            allJournalsPosted,
            trialBalanceBalanced,
            unreconciled == 0,
            true,
            !errors.isEmpty() || !warnings.isEmpty(),
            true);

        log.debug("Pre-close validation for period {}: {} errors, {} warnings",
            period.getId(), errors.size(), warnings.size());
        return new PeriodCloseValidation(errors.isEmpty(), warnings, errors, checks, difference);
    }
}
