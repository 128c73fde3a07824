package com.glengine.posting;

import com.glengine.fx.FxPolicyResolver;
import com.glengine.fx.FxRateCheck;
import com.glengine.ledger.JournalLine;
import com.glengine.ledger.JournalPostingInput;
import com.glengine.ledger.JournalValidationResult;
import com.glengine.ledger.JournalValidator;
import com.glengine.ledger.PostingContext;
import com.glengine.tax.DocumentTotals;
import com.glengine.tax.TaxCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns an AP bill into a journal and validates it.
 *
 * Journal shape, in base currency:
 * <pre>
 * Dr. Expense (per line)          line amount
 * Dr. Input tax (per tax line)    tax amount
 *     Cr. Accounts Payable            total
 * </pre>
 * The journal number is the bill number prefixed with {@code BILL-}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BillPostingAdapter {

    public static final String JOURNAL_PREFIX = "BILL-";

    private final JournalValidator journalValidator;
    private final FxPolicyResolver fxPolicyResolver;
    private final TaxCalculator taxCalculator;
    private final DocumentLineValidator lineValidator;

    public BillPostingResult validate(BillPostingInput input, String userId, String userRole) {
        if (DocumentAmounts.isBlank(input.getBillId()) || DocumentAmounts.isBlank(input.getApAccountId())
                || input.getLines() == null || input.getLines().isEmpty()) {
            return BillPostingResult.rejected(DocumentPostingErrorCode.INVALID_AMOUNTS,
                "Bill must have ID, AP account, and at least one line");
        }

        BigDecimal totalExpense = DocumentAmounts.netTotal(input.getLines());
        BigDecimal totalTax = DocumentAmounts.documentTax(input.getLines(), input.getTaxLines());
        BigDecimal totalAmount = totalExpense.add(totalTax);

        if (totalExpense.signum() <= 0) {
            return BillPostingResult.rejected(DocumentPostingErrorCode.INVALID_AMOUNTS,
                "Bill expense must be positive");
        }
        if (totalAmount.signum() <= 0) {
            return BillPostingResult.rejected(DocumentPostingErrorCode.INVALID_AMOUNTS,
                "Bill total amount must be positive");
        }

        String baseCurrency = journalValidator.getBaseCurrency();
        FxRateCheck rateCheck = fxPolicyResolver.validateRate(baseCurrency, input.getCurrency(), input.getExchangeRate());
        if (!rateCheck.isOk()) {
            return BillPostingResult.rejected(DocumentPostingErrorCode.INVALID_CURRENCY, rateCheck.getMessage());
        }
        BigDecimal rate = rateCheck.getEffectiveRate();
        String journalNumber = JOURNAL_PREFIX + input.getBillNumber();

        List<JournalLine> lines = new ArrayList<>();
        for (BillLine line : input.getLines()) {
            lines.add(JournalLine.debit(line.getExpenseAccountId(), fxPolicyResolver.toBase(line.getLineAmount(), rate),
                "Expense - " + line.getDescription(), input.getBillNumber()));
        }
        for (TaxLine taxLine : DocumentAmounts.taxLines(input.getTaxLines())) {
            lines.add(JournalLine.debit(taxLine.getTaxAccountId(), fxPolicyResolver.toBase(taxLine.getTaxAmount(), rate),
                String.format("%s Tax - %s", taxLine.getTaxCode(), input.getBillNumber()),
                input.getBillNumber()));
        }
        // AP is built from the rounded debits so per-line rounding cannot unbalance the journal
        BigDecimal unposted = DocumentAmounts.unpostedAmount(totalAmount, input.getLines(), input.getTaxLines());
        BigDecimal apAmount = DocumentAmounts.debitTotal(lines).add(fxPolicyResolver.toBase(unposted, rate));
        lines.add(JournalLine.credit(input.getApAccountId(), apAmount,
            String.format("AP - %s - %s", input.getSupplierName(), input.getBillNumber()),
            input.getBillNumber()));

        JournalPostingInput journalInput = JournalPostingInput.builder()
            .journalNumber(journalNumber)
            .description(input.getDescription() != null ? input.getDescription()
                : String.format("Bill %s - %s", input.getBillNumber(), input.getSupplierName()))
            .journalDate(input.getBillDate())
            .currency(baseCurrency)
            .lines(lines)
            .context(new PostingContext(input.getTenantId(), input.getCompanyId(), userId, userRole))
            .build();

        JournalValidationResult validation = journalValidator.validate(journalInput);
        if (!validation.isValidated()) {
            log.warn("Bill {} rejected by journal validation: {}", input.getBillNumber(), validation.getError());
            return BillPostingResult.rejected(DocumentPostingErrorCode.BUSINESS_RULE_VIOLATION,
                "Journal validation failed: " + validation.getError());
        }

        log.info("Bill {} prepared for posting: expense={} tax={} total={} {}",
            input.getBillNumber(), totalExpense, totalTax, totalAmount, input.getCurrency());

        return BillPostingResult.builder()
            .validated(true)
            .journalInput(journalInput)
            .totalExpense(totalExpense)
            .totalTax(totalTax)
            .totalAmount(totalAmount)
            .requiresApproval(validation.isRequiresApproval())
            .approverRoles(validation.getApproverRoles())
            .coaWarnings(validation.getCoaWarnings())
            .build();
    }

    public DocumentTotals calculateTotals(List<BillLine> lines) {
        return taxCalculator.totals(lines);
    }

    public LineValidation validateLines(List<BillLine> lines) {
        return lineValidator.validateLines(lines);
    }
}
