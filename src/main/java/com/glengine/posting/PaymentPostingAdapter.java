package com.glengine.posting;

import com.glengine.common.CurrencyCodes;
import com.glengine.common.Money;
import com.glengine.fx.FxPolicyResolver;
import com.glengine.fx.FxRateCheck;
import com.glengine.ledger.JournalLine;
import com.glengine.ledger.JournalPostingInput;
import com.glengine.ledger.JournalValidationResult;
import com.glengine.ledger.JournalValidator;
import com.glengine.ledger.PostingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a payment with bill and invoice allocations into a journal and validates it.
 *
 * Bill payment (outgoing):
 * <pre>
 * Dr. Accounts Payable (per bill)   allocated
 *     Cr. Bank                          total paid
 * </pre>
 * Invoice receipt (incoming):
 * <pre>
 * Dr. Bank                          total received
 *     Cr. Accounts Receivable (per invoice) allocated
 * </pre>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentPostingAdapter {

    public static final String JOURNAL_PREFIX = "PAY-";

    private final JournalValidator journalValidator;
    private final FxPolicyResolver fxPolicyResolver;

    public PaymentPostingResult validate(PaymentPostingInput input, String userId, String userRole) {
        String baseCurrency = journalValidator.getBaseCurrency();

        List<String> errors = validateBusinessRules(input, baseCurrency);
        if (!errors.isEmpty()) {
            log.warn("Payment {} failed validation: {}", input.getPaymentNumber(), errors);
            return PaymentPostingResult.builder()
                .success(false)
                .code(PaymentErrorCode.PAYMENT_VALIDATION_FAILED)
                .error("Payment validation failed: " + String.join(", ", errors))
                .errors(errors)
                .build();
        }

        BigDecimal rate = fxPolicyResolver.validateRate(baseCurrency, input.getCurrency(), input.getExchangeRate())
            .getEffectiveRate();
        String method = input.getPaymentMethod().name();
        List<PaymentAllocation> bills = ofType(input.getAllocations(), AllocationType.BILL);
        List<PaymentAllocation> invoices = ofType(input.getAllocations(), AllocationType.INVOICE);

        List<JournalLine> lines = new ArrayList<>();
        if (!bills.isEmpty()) {
            for (PaymentAllocation allocation : bills) {
                lines.add(JournalLine.debit(allocation.getApAccountId(),
                    fxPolicyResolver.toBase(allocation.getAllocatedAmount(), rate),
                    String.format("Payment %s - Bill %s", input.getPaymentNumber(), allocation.getDocumentNumber()),
                    input.getPaymentNumber()));
            }
            lines.add(JournalLine.credit(input.getBankAccountId(), DocumentAmounts.debitTotal(lines),
                String.format("Payment %s - %s", input.getPaymentNumber(), method), input.getPaymentNumber()));
        }
        if (!invoices.isEmpty()) {
            List<JournalLine> receipts = new ArrayList<>();
            for (PaymentAllocation allocation : invoices) {
                receipts.add(JournalLine.credit(allocation.getArAccountId(),
                    fxPolicyResolver.toBase(allocation.getAllocatedAmount(), rate),
                    String.format("Receipt %s - Invoice %s", input.getPaymentNumber(), allocation.getDocumentNumber()),
                    input.getPaymentNumber()));
            }
            lines.add(JournalLine.debit(input.getBankAccountId(), DocumentAmounts.creditTotal(receipts),
                String.format("Receipt %s - %s", input.getPaymentNumber(), method), input.getPaymentNumber()));
            lines.addAll(receipts);
        }

        JournalPostingInput journalInput = JournalPostingInput.builder()
            .journalNumber(JOURNAL_PREFIX + input.getPaymentNumber())
            .description(input.getDescription() != null ? input.getDescription()
                : String.format("Payment %s - %s", input.getPaymentNumber(), method))
            .journalDate(input.getPaymentDate())
            .currency(baseCurrency)
            .lines(lines)
            .context(new PostingContext(input.getTenantId(), input.getCompanyId(), userId, userRole))
            .build();

        JournalValidationResult validation = journalValidator.validate(journalInput);
        if (!validation.isValidated()) {
            log.warn("Payment {} rejected by journal validation: {}", input.getPaymentNumber(), validation.getError());
            return PaymentPostingResult.builder()
                .success(false)
                .code(PaymentErrorCode.JOURNAL_VALIDATION_FAILED)
                .error("Journal validation failed: " + validation.getError())
                .journalValidation(validation)
                .build();
        }

        BigDecimal totalAmount = fxPolicyResolver.toBase(input.getAmount(), rate);
        log.info("Payment {} prepared for posting: {} allocations, total {} {}",
            input.getPaymentNumber(), input.getAllocations().size(), totalAmount, baseCurrency);

        return PaymentPostingResult.builder()
            .success(true)
            .journalInput(journalInput)
            .journalNumber(journalInput.getJournalNumber())
            .totalAmount(totalAmount)
            .allocationsProcessed(input.getAllocations().size())
            .requiresApproval(validation.isRequiresApproval())
            .approverRoles(validation.getApproverRoles())
            .coaWarnings(validation.getCoaWarnings())
            .build();
    }

    /**
     * Every business-rule failure of the payment, in a stable order. Empty when the payment is acceptable.
     */
    public List<String> validateBusinessRules(PaymentPostingInput input, String baseCurrency) {
        List<String> errors = new ArrayList<>();

        if (input.getPaymentDate() == null) {
            errors.add("Payment date is required");
        } else if (input.getPaymentDate().isAfter(LocalDate.now())) {
            errors.add("Payment date cannot be in the future");
        }

        if (!CurrencyCodes.isValid(input.getCurrency())) {
            errors.add("Currency must be a valid 3-letter ISO code");
        } else {
            FxRateCheck rateCheck = fxPolicyResolver.validateRate(baseCurrency, input.getCurrency(), input.getExchangeRate());
            if (!rateCheck.isOk()) {
                errors.add(rateCheck.getMessage());
            }
        }

        if (!Money.isPositive(input.getAmount())) {
            errors.add("Payment amount must be positive");
        }
        if (input.getPaymentMethod() == null) {
            errors.add("Payment method is required");
        }
        if (DocumentAmounts.isBlank(input.getBankAccountId())) {
            errors.add("Bank account is required");
        }

        List<PaymentAllocation> allocations = input.getAllocations();
        if (allocations == null || allocations.isEmpty()) {
            errors.add("Payment must have at least one allocation");
            return errors;
        }

        BigDecimal totalAllocated = allocatedTotal(allocations);
        if (!Money.withinTolerance(totalAllocated, Money.orZero(input.getAmount()))) {
            errors.add(String.format("Total allocated amount (%s) does not match payment amount (%s)",
                totalAllocated, input.getAmount()));
        }

        for (int i = 0; i < allocations.size(); i++) {
            PaymentAllocation allocation = allocations.get(i);
            int n = i + 1;

            if (!Money.isPositive(allocation.getAllocatedAmount())) {
                errors.add(String.format("Allocation %d: Amount must be positive", n));
            }
            if (allocation.getType() == AllocationType.BILL) {
                if (DocumentAmounts.isBlank(allocation.getApAccountId())) {
                    errors.add(String.format("Allocation %d: AP account required for bill payments", n));
                }
                if (DocumentAmounts.isBlank(allocation.getSupplierId())) {
                    errors.add(String.format("Allocation %d: Supplier ID required for bill payments", n));
                }
            } else if (allocation.getType() == AllocationType.INVOICE) {
                if (DocumentAmounts.isBlank(allocation.getArAccountId())) {
                    errors.add(String.format("Allocation %d: AR account required for invoice receipts", n));
                }
                if (DocumentAmounts.isBlank(allocation.getCustomerId())) {
                    errors.add(String.format("Allocation %d: Customer ID required for invoice receipts", n));
                }
            } else {
                errors.add(String.format("Allocation %d: Allocation type is required", n));
            }
        }
        return errors;
    }

    public PaymentSummary calculatePaymentSummary(List<PaymentAllocation> allocations) {
        BigDecimal billPayments = allocatedTotal(ofType(allocations, AllocationType.BILL));
        BigDecimal invoiceReceipts = allocatedTotal(ofType(allocations, AllocationType.INVOICE));
        return new PaymentSummary(billPayments, invoiceReceipts, billPayments.add(invoiceReceipts));
    }

    /**
     * Check allocations against outstanding balances keyed by document id.
     * Allocating to a document with nothing outstanding is an error; over-allocating is a warning.
     */
    public AllocationCheck validateAllocations(List<PaymentAllocation> allocations,
                                               Map<String, BigDecimal> outstandingBalances) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (PaymentAllocation allocation : allocations) {
            BigDecimal outstanding = Money.orZero(outstandingBalances.get(allocation.getDocumentId()));
            BigDecimal allocated = Money.orZero(allocation.getAllocatedAmount());

            if (allocated.compareTo(outstanding) > 0) {
                if (outstanding.signum() == 0) {
                    errors.add(String.format("Document %s has no outstanding balance", allocation.getDocumentNumber()));
                } else {
                    warnings.add(String.format("Document %s: Allocated amount (%s) exceeds outstanding balance (%s)",
                        allocation.getDocumentNumber(), allocated, outstanding));
                }
            }
        }
        return new AllocationCheck(errors.isEmpty(), errors, warnings);
    }

    private static List<PaymentAllocation> ofType(List<PaymentAllocation> allocations, AllocationType type) {
        return allocations.stream().filter(allocation -> allocation.getType() == type).toList();
    }

    private static BigDecimal allocatedTotal(List<PaymentAllocation> allocations) {
        return Money.sum(allocations.stream().map(allocation -> Money.orZero(allocation.getAllocatedAmount())).toList());
    }
}
