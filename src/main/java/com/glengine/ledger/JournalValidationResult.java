package com.glengine.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of {@link JournalValidator#validate(JournalPostingInput)}.
 *
 * Accepted results carry approval routing, warnings and base-currency totals;
 * rejected results carry a code and message.
 */
@Value
@Builder
public class JournalValidationResult {

    boolean validated;

    PostingErrorCode code;
    String error;

    /**
     * Signed debit minus credit when the journal is unbalanced.
     */
    BigDecimal difference;

    @Builder.Default
    List<String> invalidAccountIds = List.of();

    boolean requiresApproval;

    @Builder.Default
    List<String> approverRoles = List.of();

    @Builder.Default
    List<CoaWarning> coaWarnings = List.of();

    BigDecimal totalDebit;
    BigDecimal totalCredit;

    /**
     * Lines converted to base currency, as they would be posted.
     */
    @Builder.Default
    List<JournalLine> baseLines = List.of();

    public static JournalValidationResult rejected(PostingRuleException e) {
        return JournalValidationResult.builder()
            .validated(false)
            .code(e.getCode())
            .error(e.getMessage())
            .difference(e.getDifference())
            .invalidAccountIds(e.getAccountIds())
            .build();
    }
}
