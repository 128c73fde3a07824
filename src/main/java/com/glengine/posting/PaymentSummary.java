package com.glengine.posting;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class PaymentSummary {
    BigDecimal billPayments;
    BigDecimal invoiceReceipts;
    BigDecimal totalAmount;
}
