package com.glengine.posting;

import com.glengine.common.Money;
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
 * Turns an AR invoice into a journal and validates it.
 *
 * Journal shape, in base currency:
 * <pre>
 * Dr. Accounts Receivable        total
 *     Cr. Revenue (per line)         line amount
 *     Cr. Tax payable (per tax line) tax amount
 * </pre>
 * The journal number is the bare invoice number.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoicePostingAdapter {

    private final JournalValidator journalValidator;
    private final FxPolicyResolver fxPolicyResolver;
    private final TaxCalculator taxCalculator;
    private final DocumentLineValidator lineValidator;

    public InvoicePostingResult validate(InvoicePostingInput input, String userId, String userRole) {
        if (DocumentAmounts.isBlank(input.getInvoiceId()) || DocumentAmounts.isBlank(input.getArAccountId())
                || input.getLines() == null || input.getLines().isEmpty()) {
            return InvoicePostingResult.rejected(DocumentPostingErrorCode.INVALID_AMOUNTS,
                "Invoice must have ID, AR account, and at least one line");
        }

        BigDecimal totalRevenue = DocumentAmounts.netTotal(input.getLines());
        BigDecimal totalTax = DocumentAmounts.documentTax(input.getLines(), input.getTaxLines());
        BigDecimal totalAmount = totalRevenue.add(totalTax);

        if (totalRevenue.signum() <= 0) {
            return InvoicePostingResult.rejected(DocumentPostingErrorCode.INVALID_AMOUNTS,
                "Invoice revenue must be positive");
        }
        if (totalAmount.signum() <= 0) {
            return InvoicePostingResult.rejected(DocumentPostingErrorCode.INVALID_AMOUNTS,
                "Invoice total amount must be positive");
        }

        String baseCurrency = journalValidator.getBaseCurrency();
        FxRateCheck rateCheck = fxPolicyResolver.validateRate(baseCurrency, input.getCurrency(), input.getExchangeRate());
        if (!rateCheck.isOk()) {
            return InvoicePostingResult.rejected(DocumentPostingErrorCode.INVALID_CURRENCY, rateCheck.getMessage());
        }
        BigDecimal rate = rateCheck.getEffectiveRate();

        List<JournalLine> lines = new ArrayList<>();
        for (InvoiceLine line : input.getLines()) {
            lines.add(JournalLine.credit(line.getRevenueAccountId(), fxPolicyResolver.toBase(line.getLineAmount(), rate),
                "Revenue - " + line.getDescription(), input.getInvoiceNumber()));
        }
        for (TaxLine taxLine : DocumentAmounts.taxLines(input.getTaxLines())) {
            lines.add(JournalLine.credit(taxLine.getTaxAccountId(), fxPolicyResolver.toBase(taxLine.getTaxAmount(), rate),
                String.format("%s Tax - %s", taxLine.getTaxCode(), input.getInvoiceNumber()),
                input.getInvoiceNumber()));
        }
        // AR is built from the rounded credits so per-line rounding cannot unbalance the journal
        BigDecimal unposted = DocumentAmounts.unpostedAmount(totalAmount, input.getLines(), input.getTaxLines());
        BigDecimal arAmount = DocumentAmounts.creditTotal(lines).add(fxPolicyResolver.toBase(unposted, rate));
        lines.add(0, JournalLine.debit(input.getArAccountId(), arAmount,
            String.format("AR - %s - %s", input.getCustomerName(), input.getInvoiceNumber()),
            input.getInvoiceNumber()));

        JournalPostingInput journalInput = JournalPostingInput.builder()
            .journalNumber(input.getInvoiceNumber())
            .description(input.getDescription() != null ? input.getDescription()
                : String.format("Invoice %s - %s", input.getInvoiceNumber(), input.getCustomerName()))
            .journalDate(input.getInvoiceDate())
            .currency(baseCurrency)
            .lines(lines)
            .context(new PostingContext(input.getTenantId(), input.getCompanyId(), userId, userRole))
            .build();

        JournalValidationResult validation = journalValidator.validate(journalInput);
        if (!validation.isValidated()) {
            log.warn("Invoice {} rejected by journal validation: {}", input.getInvoiceNumber(), validation.getError());
            return InvoicePostingResult.rejected(DocumentPostingErrorCode.BUSINESS_RULE_VIOLATION,
                "Journal validation failed: " + validation.getError());
        }

        log.info("Invoice {} prepared for posting: revenue={} tax={} total={} {}",
            input.getInvoiceNumber(), totalRevenue, totalTax, totalAmount, input.getCurrency());

        return InvoicePostingResult.builder()
            .validated(true)
            .journalInput(journalInput)
            .totalRevenue(totalRevenue)
            .totalTax(totalTax)
            .totalAmount(totalAmount)
            .requiresApproval(validation.isRequiresApproval())
            .approverRoles(validation.getApproverRoles())
            .coaWarnings(validation.getCoaWarnings())
            .build();
    }

    public DocumentTotals calculateTotals(List<InvoiceLine> lines) {
        return taxCalculator.totals(lines);
    }

    public LineValidation validateLines(List<InvoiceLine> lines) {
        return lineValidator.validateLines(lines);
    }

    /**
     * One-line summary, e.g. "Invoice INV-001 - Acme - MYR 1060.00".
     */
    public static String describe(String invoiceNumber, String customerName, String currency, BigDecimal totalAmount) {
        return String.format("Invoice %s - %s - %s %s", invoiceNumber, customerName, currency, Money.round(totalAmount));
    }
}
