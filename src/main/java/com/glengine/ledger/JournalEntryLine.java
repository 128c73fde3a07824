package com.glengine.ledger;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Persisted journal line, always in base currency.
 */
@Entity
@Table(name = "gl_journal_lines", indexes = {
    @Index(name = "idx_gl_journal_lines_journal_id", columnList = "journal_id"),
    @Index(name = "idx_gl_journal_lines_account_id", columnList = "account_id")
})
@Data
@NoArgsConstructor
public class JournalEntryLine {

    @Id
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "journal_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Journal journal;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Column(precision = 19, scale = 2)
    private BigDecimal debit;

    @Column(precision = 19, scale = 2)
    private BigDecimal credit;

    private String description;

    public JournalEntryLine(Journal journal, String accountId, BigDecimal debit,
                            BigDecimal credit, String description) {
        this.id = UUID.randomUUID().toString();
        this.journal = journal;
        this.accountId = accountId;
        this.debit = debit;
        this.credit = credit;
        this.description = description;
    }
}
