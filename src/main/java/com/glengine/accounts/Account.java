package com.glengine.accounts;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A ledger account in the chart of accounts.
 *
 * Accounts form a tree through {@code parentId}. Every account referenced by a
 * journal line must exist and be active.
 */
@Entity
@Table(name = "gl_accounts", indexes = {
    @Index(name = "idx_gl_accounts_parent_id", columnList = "parent_id"),
    @Index(name = "idx_gl_accounts_code", columnList = "code")
})
@Data
@NoArgsConstructor
public class Account {

    @Id
    private String id;

    /**
     * Human-readable ledger code, e.g. "1100".
     */
    private String code;

    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_type")
    private AccountType type;

    @Column(name = "parent_id")
    private String parentId;

    private String currency;

    private boolean active;

    @Column(name = "created_at")
    private Instant createdAt;

    public Account(String id, String code, String name, AccountType type,
                   String parentId, String currency, boolean active) {
        this.id = id;
        this.code = code;
        this.name = name;
        this.type = type;
        this.parentId = parentId;
        this.currency = currency;
        this.active = active;
        this.createdAt = Instant.now();
    }

    /**
     * Detached copy; changes to it reach the database only through a save.
     */
    public Account snapshot() {
        Account copy = new Account(id, code, name, type, parentId, currency, active);
        copy.setCreatedAt(createdAt);
        return copy;
    }

    public boolean isRoot() {
        return parentId == null;
    }
}
