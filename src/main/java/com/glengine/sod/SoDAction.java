package com.glengine.sod;

/**
 * Sensitive operations guarded by segregation-of-duties rules.
 */
public enum SoDAction {
    JOURNAL_POST("journal:post"),
    PERIOD_CLOSE("period:close"),
    PERIOD_OPEN("period:open"),
    PERIOD_LOCK("period:lock");

    private final String actionName;

    SoDAction(String actionName) {
        this.actionName = actionName;
    }

    public String getActionName() {
        return actionName;
    }

    /**
     * Match against a configured pattern: an exact name, {@code *}, or a
     * prefix wildcard such as {@code period:*}.
     */
    public boolean matches(String pattern) {
        if (pattern == null) {
            return false;
        }
        if ("*".equals(pattern)) {
            return true;
        }
        if (pattern.endsWith(":*")) {
            return actionName.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        return actionName.equals(pattern);
    }
}
