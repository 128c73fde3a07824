package com.glengine.posting;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentPostingInput {

    private String tenantId;
    private String companyId;
    private String paymentId;
    private String paymentNumber;
    private LocalDate paymentDate;
    private PaymentMethod paymentMethod;
    private String bankAccountId;
    private String currency;

    /**
     * Rate to base currency. May be omitted for base-currency payments.
     */
    private BigDecimal exchangeRate;

    private BigDecimal amount;
    private String reference;
    private String description;
    private List<PaymentAllocation> allocations;
}
