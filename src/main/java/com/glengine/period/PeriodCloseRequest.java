package com.glengine.period;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PeriodCloseRequest {

    private String tenantId;
    private String companyId;
    private String fiscalPeriodId;

    /**
     * Effective close time, stamped as closedAt. Must not be in the future.
     */
    private Instant closeDate;

    private String closedBy;
    private String userRole;
    private String closeReason;

    /**
     * Close even when pre-close validation reports errors.
     */
    private boolean forceClose;

    /**
     * Schedule reversals of the period's accrual journals into the next period.
     */
    private boolean generateReversingEntries;
}
