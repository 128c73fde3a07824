package com.glengine.period;

/**
 * A reversing entry is PENDING until the downstream reversal job posts it.
 */
public enum ReversingEntryStatus {
    PENDING,
    POSTED
}
