package com.glengine.posting;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * An AR invoice to be turned into a journal. Amounts are in the invoice currency.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvoicePostingInput {

    private String tenantId;
    private String companyId;
    private String invoiceId;
    private String invoiceNumber;
    private String customerId;
    private String customerName;
    private LocalDate invoiceDate;
    private String currency;
    private BigDecimal exchangeRate;

    /**
     * Receivable account debited with the invoice total.
     */
    private String arAccountId;

    private List<InvoiceLine> lines;

    @Builder.Default
    private List<TaxLine> taxLines = new ArrayList<>();

    private String description;
}
