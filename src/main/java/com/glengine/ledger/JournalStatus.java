package com.glengine.ledger;

public enum JournalStatus {
    DRAFT,
    POSTED
}
