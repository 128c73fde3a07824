package com.glengine.sod;

import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Allows or denies an action based on the role's allow and deny lists.
 */
@Component
@Order(1)
@RequiredArgsConstructor
public class RolePermissionRule implements SoDRule {

    private final SoDPolicyProperties properties;

    @Override
    public SoDDecision evaluate(SoDRequest request) {
        SoDPolicyProperties.RolePolicy policy = properties.policyFor(request.getUserRole());
        String action = request.getAction().getActionName();

        if (policy == null) {
            return SoDDecision.deny(String.format("Unknown role '%s'", request.getUserRole()));
        }
        if (policy.getDeny().stream().anyMatch(request.getAction()::matches)) {
            return SoDDecision.deny(
                String.format("Role '%s' is explicitly denied %s", request.getUserRole(), action));
        }
        if (policy.getAllow().stream().anyMatch(request.getAction()::matches)) {
            return SoDDecision.allow();
        }
        return SoDDecision.deny(
            String.format("Role '%s' is not permitted to perform %s", request.getUserRole(), action));
    }

    @Override
    public String getRuleName() {
        return "RolePermission";
    }
}
