package com.glengine.sod;

import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Flags actions the role may perform only with approval.
 */
@Component
@Order(3)
@RequiredArgsConstructor
public class ApprovalActionRule implements SoDRule {

    private final SoDPolicyProperties properties;

    @Override
    public SoDDecision evaluate(SoDRequest request) {
        SoDPolicyProperties.RolePolicy policy = properties.policyFor(request.getUserRole());
        if (policy != null && policy.getApprovalActions().stream().anyMatch(request.getAction()::matches)) {
            return SoDDecision.allowWithApproval(
                String.format("%s requires approval for role '%s'",
                    request.getAction().getActionName(), request.getUserRole()));
        }
        return SoDDecision.allow();
    }

    @Override
    public String getRuleName() {
        return "ApprovalAction";
    }
}
