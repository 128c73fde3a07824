package com.glengine.sod;

import lombok.Value;

/**
 * Three-state authorization decision.
 *
 * {@code allowed=false} is always fatal. {@code allowed=true} with
 * {@code requiresApproval=true} means proceed, but flag the result for an approver.
 */
@Value
public class SoDDecision {
    boolean allowed;
    boolean requiresApproval;
    String reason;

    public static SoDDecision allow() {
        return new SoDDecision(true, false, null);
    }

    public static SoDDecision allowWithApproval(String reason) {
        return new SoDDecision(true, true, reason);
    }

    public static SoDDecision deny(String reason) {
        return new SoDDecision(false, false, reason);
    }
}
