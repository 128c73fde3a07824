package com.glengine.period;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PeriodOpenRequest {

    private String tenantId;
    private String companyId;
    private String fiscalPeriodId;
    private String openedBy;
    private String userRole;
    private String openReason;

    /**
     * When set, the reopen only proceeds if the caller's role is one whose
     * reopen is routed through approval.
     */
    private boolean approvalRequired;
}
