package com.glengine.sod;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Evaluates every configured {@link SoDRule} for a request.
 *
 * The first rule that denies ends evaluation. Otherwise the action is allowed,
 * and flagged for approval if any rule asked for it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SoDAuthorizer {

    private final List<SoDRule> rules;
    private final SoDPolicyProperties properties;

    public SoDDecision check(SoDRequest request) {
        log.debug("Evaluating {} SoD rules for {} by role '{}'",
            rules.size(), request.getAction().getActionName(), request.getUserRole());

        String approvalReason = null;
        for (SoDRule rule : rules) {
            SoDDecision decision = rule.evaluate(request);

            if (!decision.isAllowed()) {
                log.warn("SoD rule {} denied {} for user {} (role '{}'): {}", rule.getRuleName(),
                    request.getAction().getActionName(), request.getUserId(), request.getUserRole(),
                    decision.getReason());
                return decision;
            }
            if (decision.isRequiresApproval() && approvalReason == null) {
                approvalReason = decision.getReason();
            }

            log.debug("SoD rule {} allowed", rule.getRuleName());
        }

        if (approvalReason != null) {
            log.info("{} by user {} allowed pending approval: {}",
                request.getAction().getActionName(), request.getUserId(), approvalReason);
            return SoDDecision.allowWithApproval(approvalReason);
        }
        return SoDDecision.allow();
    }

    /**
     * Roles that may approve a flagged transaction.
     */
    public List<String> getApproverRoles() {
        return List.copyOf(properties.getApproverRoles());
    }
}
