package com.glengine.ledger;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A journal as persisted by the posting caller.
 *
 * The engine reads journals (unposted counts, trial balance, accrual scans)
 * but never writes them.
 */
@Entity
@Table(name = "gl_journal", indexes = {
    @Index(name = "idx_gl_journal_scope_date", columnList = "tenant_id, company_id, journal_date"),
    @Index(name = "idx_gl_journal_status", columnList = "status")
})
@Data
@NoArgsConstructor
public class Journal {

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "company_id", nullable = false)
    private String companyId;

    private String journalNumber;

    private String description;

    /**
     * Free-text reference. Accrual journals carry "ACCRUAL" somewhere in it.
     */
    private String reference;

    @Column(name = "journal_date", nullable = false)
    private LocalDate journalDate;

    private String currency;

    @Enumerated(EnumType.STRING)
    private JournalStatus status;

    @Column(name = "created_at")
    private Instant createdAt;

    @OneToMany(mappedBy = "journal", cascade = CascadeType.ALL, orphanRemoval = true)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<JournalEntryLine> lines = new ArrayList<>();

    public Journal(String tenantId, String companyId, String journalNumber, String description,
                   String reference, LocalDate journalDate, String currency, JournalStatus status) {
        this.id = UUID.randomUUID().toString();
        this.tenantId = tenantId;
        this.companyId = companyId;
        this.journalNumber = journalNumber;
        this.description = description;
        this.reference = reference;
        this.journalDate = journalDate;
        this.currency = currency;
        this.status = status;
        this.createdAt = Instant.now();
    }

    public Journal addLine(String accountId, BigDecimal debit, BigDecimal credit, String description) {
        lines.add(new JournalEntryLine(this, accountId, debit, credit, description));
        return this;
    }
}
