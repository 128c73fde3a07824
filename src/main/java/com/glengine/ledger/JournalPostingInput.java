package com.glengine.ledger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * A proposed journal, validated once and then either persisted by the caller or discarded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JournalPostingInput {

    private String journalNumber;

    private String description;

    private LocalDate journalDate;

    /**
     * ISO currency of the line amounts.
     */
    private String currency;

    /**
     * Rate to base currency. Required only when {@link #currency} is not the base currency.
     */
    private BigDecimal exchangeRate;

    private List<JournalLine> lines;

    private PostingContext context;
}
