package com.glengine.ledger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One proposed debit/credit line of a journal.
 *
 * A line may carry both sides as zero-or-positive; only the journal as a whole
 * must balance.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JournalLine {

    private String accountId;

    @Builder.Default
    private BigDecimal debit = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal credit = BigDecimal.ZERO;

    private String description;

    private String reference;

    public static JournalLine debit(String accountId, BigDecimal amount, String description, String reference) {
        return new JournalLine(accountId, amount, BigDecimal.ZERO, description, reference);
    }

    public static JournalLine credit(String accountId, BigDecimal amount, String description, String reference) {
        return new JournalLine(accountId, BigDecimal.ZERO, amount, description, reference);
    }
}
