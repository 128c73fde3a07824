package com.glengine.period;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PeriodLockRequest {

    private String tenantId;
    private String companyId;
    private String fiscalPeriodId;
    private PeriodLockType lockType;
    private String lockedBy;
    private String userRole;
    private String reason;
}
