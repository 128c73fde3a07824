package com.glengine.period;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A scheduled reversal of an accrual journal, dated at the start of the next period.
 * At most one exists per original journal.
 */
@Entity
@Table(name = "reversing_entries", uniqueConstraints = {
    @UniqueConstraint(name = "uq_reversing_entries_original", columnNames = "original_journal_id")
})
@Data
@NoArgsConstructor
public class ReversingEntry {

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "company_id", nullable = false)
    private String companyId;

    @Column(name = "original_journal_id", nullable = false)
    private String originalJournalId;

    /**
     * The closing period the accrual was found in.
     */
    @Column(name = "fiscal_period_id")
    private String fiscalPeriodId;

    @Column(name = "reversal_date", nullable = false)
    private LocalDate reversalDate;

    @Column(name = "reversal_reason")
    private String reversalReason;

    @Enumerated(EnumType.STRING)
    private ReversingEntryStatus status;

    @Column(name = "created_by")
    private String createdBy;

    @Column(name = "created_at")
    private Instant createdAt;

    public ReversingEntry(String tenantId, String companyId, String originalJournalId, String fiscalPeriodId,
                          LocalDate reversalDate, String reversalReason, String createdBy) {
        this.id = UUID.randomUUID().toString();
        this.tenantId = tenantId;
        this.companyId = companyId;
        this.originalJournalId = originalJournalId;
        this.fiscalPeriodId = fiscalPeriodId;
        this.reversalDate = reversalDate;
        this.reversalReason = reversalReason;
        this.status = ReversingEntryStatus.PENDING;
        this.createdBy = createdBy;
        this.createdAt = Instant.now();
    }
}
