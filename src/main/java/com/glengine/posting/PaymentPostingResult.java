package com.glengine.posting;

import com.glengine.ledger.CoaWarning;
import com.glengine.ledger.JournalLine;
import com.glengine.ledger.JournalPostingInput;
import com.glengine.ledger.JournalValidationResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * The journal prepared from a payment, or why it could not be.
 * Amounts are in base currency.
 */
@Value
@Builder
public class PaymentPostingResult {

    boolean success;
    PaymentErrorCode code;
    String error;

    /**
     * Every business-rule failure, for PAYMENT_VALIDATION_FAILED.
     */
    @Builder.Default
    List<String> errors = List.of();

    /**
     * The rejected journal validation, for JOURNAL_VALIDATION_FAILED.
     */
    JournalValidationResult journalValidation;

    JournalPostingInput journalInput;
    String journalNumber;
    BigDecimal totalAmount;
    int allocationsProcessed;

    boolean requiresApproval;

    @Builder.Default
    List<String> approverRoles = List.of();

    @Builder.Default
    List<CoaWarning> coaWarnings = List.of();

    public List<JournalLine> getLines() {
        return journalInput != null ? journalInput.getLines() : List.of();
    }
}
