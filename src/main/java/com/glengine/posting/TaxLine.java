package com.glengine.posting;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Document-level tax posting: one journal line per tax line.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaxLine {

    private String taxCode;
    private String taxAccountId;
    private BigDecimal taxAmount;
    private TaxType taxType;
}
