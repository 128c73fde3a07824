package com.glengine.common.exception;

/**
 * Thrown when a period lock row cannot be inserted.
 * During a close this rolls back the whole close.
 */
public class PeriodLockException extends GlEngineException {

    public PeriodLockException(String fiscalPeriodId, String reason, Throwable cause) {
        super(String.format("Failed to create period lock for %s: %s", fiscalPeriodId, reason), cause);
    }
}
