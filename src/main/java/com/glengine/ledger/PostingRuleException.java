package com.glengine.ledger;

import java.math.BigDecimal;
import java.util.List;

/**
 * Raised by a validation step when a journal breaks a posting rule.
 *
 * Caught by {@link JournalValidator} and turned into a rejected
 * {@link JournalValidationResult}; it never leaves the validator.
 */
public class PostingRuleException extends RuntimeException {

    private final PostingErrorCode code;
    private final BigDecimal difference;
    private final List<String> accountIds;

    public PostingRuleException(PostingErrorCode code, String message) {
        this(code, message, null, List.of());
    }

    private PostingRuleException(PostingErrorCode code, String message,
                                 BigDecimal difference, List<String> accountIds) {
        super(message);
        this.code = code;
        this.difference = difference;
        this.accountIds = accountIds;
    }

    public static PostingRuleException unbalanced(BigDecimal totalDebit, BigDecimal totalCredit) {
        BigDecimal difference = totalDebit.subtract(totalCredit);
        return new PostingRuleException(PostingErrorCode.JOURNAL_UNBALANCED,
            String.format("Journal must be balanced: debits %s, credits %s, difference %s",
                totalDebit, totalCredit, difference),
            difference, List.of());
    }

    public static PostingRuleException invalidAccounts(String message, List<String> accountIds) {
        return new PostingRuleException(PostingErrorCode.INVALID_ACCOUNTS, message, null, List.copyOf(accountIds));
    }

    public PostingErrorCode getCode() {
        return code;
    }

    /**
     * Signed debit minus credit, for unbalanced journals.
     */
    public BigDecimal getDifference() {
        return difference;
    }

    public List<String> getAccountIds() {
        return accountIds;
    }
}
