package com.glengine.posting;

import com.glengine.ledger.CoaWarning;
import com.glengine.ledger.JournalPostingInput;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * The journal prepared from an invoice, or the reason it could not be.
 * Totals are in the invoice currency.
 */
@Value
@Builder
public class InvoicePostingResult {

    boolean validated;
    DocumentPostingErrorCode code;
    String error;

    JournalPostingInput journalInput;
    BigDecimal totalRevenue;
    BigDecimal totalTax;
    BigDecimal totalAmount;

    boolean requiresApproval;

    @Builder.Default
    List<String> approverRoles = List.of();

    @Builder.Default
    List<CoaWarning> coaWarnings = List.of();

    public static InvoicePostingResult rejected(DocumentPostingErrorCode code, String error) {
        return InvoicePostingResult.builder()
            .validated(false)
            .code(code)
            .error(error)
            .build();
    }
}
