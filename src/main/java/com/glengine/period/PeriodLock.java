package com.glengine.period;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A lock placed on a fiscal period. Locks are never deleted; reopening the
 * period deactivates them.
 */
@Entity
@Table(name = "period_locks", indexes = {
    @Index(name = "idx_period_locks_period_active", columnList = "fiscal_period_id, active")
})
@Data
@NoArgsConstructor
public class PeriodLock {

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "company_id", nullable = false)
    private String companyId;

    @Column(name = "fiscal_period_id", nullable = false)
    private String fiscalPeriodId;

    @Enumerated(EnumType.STRING)
    @Column(name = "lock_type", nullable = false)
    private PeriodLockType lockType;

    @Column(name = "locked_by")
    private String lockedBy;

    private String reason;

    private boolean active;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "released_at")
    private Instant releasedAt;

    public PeriodLock(String tenantId, String companyId, String fiscalPeriodId,
                      PeriodLockType lockType, String lockedBy, String reason) {
        this.id = UUID.randomUUID().toString();
        this.tenantId = tenantId;
        this.companyId = companyId;
        this.fiscalPeriodId = fiscalPeriodId;
        this.lockType = lockType;
        this.lockedBy = lockedBy;
        this.reason = reason;
        this.active = true;
        this.createdAt = Instant.now();
    }
}
