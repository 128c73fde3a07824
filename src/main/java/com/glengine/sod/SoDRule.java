package com.glengine.sod;

/**
 * A single segregation-of-duties rule.
 *
 * Rules are evaluated in order; the first denial wins and approval flags
 * from every rule are combined.
 */
public interface SoDRule {

    /**
     * Evaluate the rule for a request.
     *
     * @param request who is attempting which action
     * @return allow, allow-with-approval or deny
     */
    SoDDecision evaluate(SoDRequest request);

    String getRuleName();
}
