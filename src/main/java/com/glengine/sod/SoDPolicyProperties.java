package com.glengine.sod;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Role policies bound from {@code gl-engine.sod.*}.
 *
 * The built-in roles below apply unless overridden in configuration. A role
 * with no entry is denied everything.
 */
@Data
@ConfigurationProperties(prefix = "gl-engine.sod")
public class SoDPolicyProperties {

    /**
     * Roles reported as able to approve a flagged transaction.
     */
    private List<String> approverRoles = new ArrayList<>(List.of("manager", "admin"));

    private Map<String, RolePolicy> roles = defaultRoles();

    @Data
    public static class RolePolicy {

        /**
         * Action patterns this role may perform ({@code *} and {@code period:*} style wildcards).
         */
        private List<String> allow = new ArrayList<>();

        /**
         * Action patterns this role may never perform. Deny wins over allow.
         */
        private List<String> deny = new ArrayList<>();

        /**
         * Amount above which a permitted action must be approved. Null means no threshold.
         */
        private BigDecimal approvalThreshold;

        /**
         * Actions that always require approval for this role.
         */
        private List<String> approvalActions = new ArrayList<>();
    }

    public static Map<String, RolePolicy> defaultRoles() {
        Map<String, RolePolicy> roles = new LinkedHashMap<>();
        roles.put("admin", policy(List.of("*"), List.of(), null, List.of()));
        roles.put("manager", policy(List.of("journal:post", "period:*"), List.of(),
            new BigDecimal("50000.00"), List.of("period:open")));
        roles.put("accountant", policy(List.of("journal:post"), List.of(),
            new BigDecimal("10000.00"), List.of()));
        roles.put("clerk", policy(List.of(), List.of("journal:post"), null, List.of()));
        roles.put("viewer", policy(List.of(), List.of(), null, List.of()));
        return roles;
    }

    private static RolePolicy policy(List<String> allow, List<String> deny,
                                     BigDecimal threshold, List<String> approvalActions) {
        RolePolicy policy = new RolePolicy();
        policy.setAllow(new ArrayList<>(allow));
        policy.setDeny(new ArrayList<>(deny));
        policy.setApprovalThreshold(threshold);
        policy.setApprovalActions(new ArrayList<>(approvalActions));
        return policy;
    }

    public RolePolicy policyFor(String role) {
        return role == null ? null : roles.get(role);
    }
}
