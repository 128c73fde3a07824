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
 * An AP bill to be turned into a journal. Amounts are in the bill currency.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BillPostingInput {

    private String tenantId;
    private String companyId;
    private String billId;
    private String billNumber;
    private String supplierId;
    private String supplierName;
    private LocalDate billDate;
    private String currency;
    private BigDecimal exchangeRate;

    /**
     * Payable account credited with the bill total.
     */
    private String apAccountId;

    private List<BillLine> lines;

    /**
     * Input tax lines, debited to their tax accounts.
     */
    @Builder.Default
    private List<TaxLine> taxLines = new ArrayList<>();

    private String description;
}
