package com.glengine.posting;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BillLine implements PricedLine {

    private int lineNumber;
    private String description;
    private BigDecimal quantity;
    private BigDecimal unitPrice;
    private BigDecimal lineAmount;
    private String expenseAccountId;
    private String taxCode;
    private BigDecimal taxRate;
    private BigDecimal taxAmount;
}
