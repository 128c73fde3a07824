package com.glengine.period;

import java.time.LocalDate;

/**
 * Counts bank transactions that are not yet reconciled.
 */
public interface BankReconciliationSource {

    long countUnreconciled(String tenantId, String companyId, LocalDate asOf);
}
