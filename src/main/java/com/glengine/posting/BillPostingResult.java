package com.glengine.posting;

import com.glengine.ledger.CoaWarning;
import com.glengine.ledger.JournalPostingInput;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * The journal prepared from a bill, or the reason it could not be.
 * Totals are in the bill currency.
 */
@Value
@Builder
public class BillPostingResult {

    boolean validated;
    DocumentPostingErrorCode code;
    String error;

    JournalPostingInput journalInput;
    BigDecimal totalExpense;
    BigDecimal totalTax;
    BigDecimal totalAmount;

    boolean requiresApproval;

    @Builder.Default
    List<String> approverRoles = List.of();

    @Builder.Default
    List<CoaWarning> coaWarnings = List.of();

    public static BillPostingResult rejected(DocumentPostingErrorCode code, String error) {
        return BillPostingResult.builder()
            .validated(false)
            .code(code)
            .error(error)
            .build();
    }
}
