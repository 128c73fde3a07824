package com.glengine.sod;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Who is attempting what, and for how much.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SoDRequest {

    private String tenantId;
    private String companyId;
    private String userId;
    private String userRole;

    private SoDAction action;

    /**
     * Aggregate amount in base currency; null for actions without an amount.
     */
    private BigDecimal amount;
}
