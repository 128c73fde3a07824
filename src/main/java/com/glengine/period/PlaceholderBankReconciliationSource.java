package com.glengine.period;

import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Bank reconciliation is not tracked yet, so nothing is ever reported as unreconciled.
 */
@Component
public class PlaceholderBankReconciliationSource implements BankReconciliationSource {

    @Override
    public long countUnreconciled(String tenantId, String companyId, LocalDate asOf) {
        return 0;
    }
}
