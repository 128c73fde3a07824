package com.glengine.period;

public enum PeriodLockType {
    /** Blocks new postings into the period. */
    POSTING,
    /** Freezes reporting figures; postings still pass. */
    REPORTING,
    /** Blocks everything and moves a closed period to LOCKED. */
    FULL;

    public boolean blocksPosting() {
        return this == POSTING || this == FULL;
    }
}
