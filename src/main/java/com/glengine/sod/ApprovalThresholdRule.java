package com.glengine.sod;

import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Flags amounts above the role's approval threshold.
 */
@Component
@Order(2)
@RequiredArgsConstructor
public class ApprovalThresholdRule implements SoDRule {

    private final SoDPolicyProperties properties;

    @Override
    public SoDDecision evaluate(SoDRequest request) {
        SoDPolicyProperties.RolePolicy policy = properties.policyFor(request.getUserRole());
        if (policy == null || policy.getApprovalThreshold() == null || request.getAmount() == null) {
            return SoDDecision.allow();
        }

        BigDecimal threshold = policy.getApprovalThreshold();
        if (request.getAmount().compareTo(threshold) > 0) {
            return SoDDecision.allowWithApproval(
                String.format("Amount %s exceeds approval threshold %s for role '%s'",
                    request.getAmount(), threshold, request.getUserRole()));
        }
        return SoDDecision.allow();
    }

    @Override
    public String getRuleName() {
        return "ApprovalThreshold";
    }
}
