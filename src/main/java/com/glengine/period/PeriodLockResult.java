package com.glengine.period;

import lombok.Value;

import java.util.List;

@Value
public class PeriodLockResult {
    boolean success;
    String lockId;
    String error;
    PeriodErrorCode code;
    boolean requiresApproval;
    List<String> approverRoles;

    public static PeriodLockResult locked(String lockId, boolean requiresApproval, List<String> approverRoles) {
        return new PeriodLockResult(true, lockId, null, null, requiresApproval, approverRoles);
    }

    public static PeriodLockResult refused(PeriodErrorCode code, String error) {
        return new PeriodLockResult(false, null, error, code, false, List.of());
    }
}
