package com.glengine.period;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of closing or reopening a fiscal period.
 */
@Value
@Builder
public class PeriodOperationResult {

    boolean success;
    PeriodErrorCode code;
    String error;

    /**
     * Individual input errors, for INVALID_INPUT.
     */
    @Builder.Default
    List<String> inputErrors = List.of();

    String fiscalPeriodId;
    FiscalPeriodStatus status;
    Instant closedAt;
    String closedBy;
    int reversingEntriesCreated;
    String nextPeriodId;

    /**
     * Set when the operation was allowed but must be routed to an approver.
     */
    boolean requiresApproval;

    @Builder.Default
    List<String> approverRoles = List.of();

    /**
     * Pre-close report, for closes and PERIOD_CLOSE_VALIDATION_FAILED.
     */
    PeriodCloseValidation validation;

    public static PeriodOperationResult failure(PeriodErrorCode code, String error) {
        return PeriodOperationResult.builder()
            .success(false)
            .code(code)
            .error(error)
            .build();
    }
}
