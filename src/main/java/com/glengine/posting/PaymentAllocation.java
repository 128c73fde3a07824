package com.glengine.posting;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * The part of a payment applied to one bill or invoice.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentAllocation {

    private AllocationType type;
    private String documentId;
    private String documentNumber;

    /** Required for bill allocations. */
    private String supplierId;

    /** Required for invoice allocations. */
    private String customerId;

    private BigDecimal allocatedAmount;

    /** Payable account debited for a bill allocation. */
    private String apAccountId;

    /** Receivable account credited for an invoice allocation. */
    private String arAccountId;
}
